package org.nowstart.tseval;

import static org.mockito.Mockito.mockStatic;

import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

class ApplicationTest {

    @Test
    void constructor_canBeInstantiatedForCoverage() {
        new Application();
    }

    @Test
    void main_invokesSpringApplicationRun() {
        String[] args = new String[] {"--tseval.evaluation.enabled=false"};

        try (MockedStatic<SpringApplication> springApplication = mockStatic(SpringApplication.class)) {
            Application.main(args);

            springApplication.verify(() -> SpringApplication.run(Application.class, args));
        }
    }
}
