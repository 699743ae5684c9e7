package org.nowstart.tseval.metric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class RocAucMetricTest {

    private final RocAucMetric metric = new RocAucMetric();

    @Test
    void score_matchesReferenceExample() {
        double auc = metric.score(new double[] {0.1, 0.4, 0.35, 0.8}, new int[] {0, 0, 1, 1});

        assertThat(auc).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void score_isOneForPerfectRankingAndZeroForInverted() {
        int[] labels = {0, 0, 1, 1};

        assertThat(metric.score(new double[] {0.1, 0.2, 0.8, 0.9}, labels)).isEqualTo(1.0);
        assertThat(metric.score(new double[] {0.9, 0.8, 0.2, 0.1}, labels)).isEqualTo(0.0);
    }

    @Test
    void score_givesHalfForConstantScores() {
        assertThat(metric.score(new double[] {0.5, 0.5, 0.5, 0.5}, new int[] {0, 1, 0, 1})).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void score_treatsNanAsZeroAndPositiveInfinityAsOne() {
        double auc = metric.score(new double[] {Double.NaN, 0.5, Double.POSITIVE_INFINITY}, new int[] {0, 0, 1});

        assertThat(auc).isEqualTo(1.0);
    }

    @Test
    void score_throwsWhenOnlyOneClassPresent() {
        assertThatThrownBy(() -> metric.score(new double[] {0.1, 0.2}, new int[] {0, 0}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Only one class present");
    }

    @Test
    void score_throwsOnLengthMismatch() {
        assertThatThrownBy(() -> metric.score(new double[] {0.1, 0.2}, new int[] {0, 1, 0}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("inconsistent numbers of samples");
    }

    @Test
    void score_throwsOnEmptyInput() {
        assertThatThrownBy(() -> metric.score(new double[0], new int[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
