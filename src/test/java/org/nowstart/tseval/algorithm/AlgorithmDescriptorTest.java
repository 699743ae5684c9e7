package org.nowstart.tseval.algorithm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nowstart.tseval.data.exception.AlgorithmInvocationException;
import org.nowstart.tseval.data.type.InputMode;

class AlgorithmDescriptorTest {

    private static final double[][] VALUES = {{1.0, 2.0}, {3.0, 4.0}};

    @TempDir
    Path tempDir;

    @Test
    void constructor_trimsNameAndDefaultsPostprocessor() {
        AlgorithmDescriptor descriptor = AlgorithmDescriptor.ofArray("  mean ", DetectorFixtures::deviatingFromMean);

        assertThat(descriptor.name()).isEqualTo("mean");
        assertThat(descriptor.inputMode()).isEqualTo(InputMode.ARRAY);
        assertThat(descriptor.postprocessor()).isSameAs(ScorePostprocessor.IDENTITY);
        assertThat(descriptor.expectsFilePath()).isFalse();
    }

    @Test
    void constructor_rejectsBlankName() {
        assertThatThrownBy(() -> AlgorithmDescriptor.ofArray(" ", values -> new double[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name");
    }

    @Test
    void constructor_rejectsDetectorNotMatchingMode() {
        ArrayDetector array = values -> new double[0];
        FileDetector file = path -> new double[0];

        assertThatThrownBy(() -> new AlgorithmDescriptor("x", InputMode.ARRAY, null, file, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AlgorithmDescriptor("x", InputMode.FILE_PATH, array, file, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invoke_passesArrayToArrayDetector() {
        AlgorithmDescriptor descriptor = AlgorithmDescriptor.ofArray("first", values -> new double[] {values[0][0], values[1][1]});

        assertThat(descriptor.invoke(VALUES, tempDir)).containsExactly(1.0, 4.0);
    }

    @Test
    void invoke_writesTemporaryCsvForFileDetectorAndDeletesIt() throws IOException {
        List<Path> seen = new ArrayList<>();
        List<String> contents = new ArrayList<>();
        AlgorithmDescriptor descriptor = AlgorithmDescriptor.ofFile("file", path -> {
            seen.add(path);
            contents.addAll(Files.readAllLines(path));
            return new double[] {0.5, 0.5};
        });

        double[] scores = descriptor.invoke(VALUES, tempDir);

        assertThat(scores).containsExactly(0.5, 0.5);
        assertThat(seen).singleElement().satisfies(path -> {
            assertThat(path.getParent()).isEqualTo(tempDir);
            assertThat(path).doesNotExist();
        });
        assertThat(contents).containsExactly("1.0,2.0", "3.0,4.0");
        assertThat(listTempDir()).isEmpty();
    }

    @Test
    void invoke_deletesTemporaryFileWhenFileDetectorThrows() throws IOException {
        AlgorithmDescriptor descriptor = AlgorithmDescriptor.ofFile("broken", path -> {
            throw new IOException("cannot parse " + path.getFileName());
        });

        assertThatThrownBy(() -> descriptor.invoke(VALUES, tempDir))
                .isInstanceOf(AlgorithmInvocationException.class)
                .hasMessageContaining("Algorithm broken failed: cannot parse")
                .hasCauseInstanceOf(IOException.class);
        assertThat(listTempDir()).isEmpty();
    }

    @Test
    void invoke_rethrowsRuntimeExceptionsUnchanged() {
        AlgorithmDescriptor descriptor = DetectorFixtures.failing("bad", "boom");

        assertThatThrownBy(() -> descriptor.invoke(VALUES, tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("boom");
    }

    @Test
    void invoke_wrapsInterruptionAndRestoresFlag() {
        AlgorithmDescriptor descriptor = AlgorithmDescriptor.ofArray("interrupted", values -> {
            throw new InterruptedException("stop");
        });

        try {
            assertThatThrownBy(() -> descriptor.invoke(VALUES, tempDir))
                    .isInstanceOf(AlgorithmInvocationException.class)
                    .hasMessageContaining("interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void withPostprocessor_keepsDetector() {
        AlgorithmDescriptor descriptor = DetectorFixtures.zerosLike("zeros")
                .withPostprocessor(scores -> new double[] {9.0});

        assertThat(descriptor.name()).isEqualTo("zeros");
        assertThat(descriptor.postprocessor().apply(new double[0])).containsExactly(9.0);
        assertThat(descriptor.invoke(VALUES, tempDir)).containsExactly(0.0, 0.0);
    }

    private List<Path> listTempDir() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.toList();
        }
    }
}
