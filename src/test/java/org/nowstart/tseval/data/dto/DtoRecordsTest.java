package org.nowstart.tseval.data.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.tseval.data.type.TrialStatus;

class DtoRecordsTest {

    @Test
    void loadedDataset_rejectsMismatchedLengthsAndNonBinaryLabels() {
        assertThatThrownBy(() -> new LoadedDataset("d", new double[][] {{1.0}}, new int[] {0, 1}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("identical lengths");
        assertThatThrownBy(() -> new LoadedDataset("d", new double[][] {{1.0}}, new int[] {2}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("binary");
    }

    @Test
    void loadedDataset_comparesArrayContents() {
        LoadedDataset first = new LoadedDataset("d", new double[][] {{1.0, 2.0}, {3.0, 4.0}}, new int[] {0, 1});
        LoadedDataset second = new LoadedDataset("d", new double[][] {{1.0, 2.0}, {3.0, 4.0}}, new int[] {0, 1});

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(new LoadedDataset("e", first.values(), first.labels()));
        assertThat(first.dimensions()).isEqualTo(2);
        assertThat(first.isUnivariate()).isFalse();
        assertThat(first.anomalyCount()).isEqualTo(1);
        assertThat(first.toString()).contains("length=2", "anomalies=1");
    }

    @Test
    void metricScore_unavailableCarriesNanAndReason() {
        MetricScore score = MetricScore.unavailable("ROC_AUC", "single class");

        assertThat(score.available()).isFalse();
        assertThat(score.value()).isNaN();
        assertThat(score.reason()).isEqualTo("single class");
        assertThat(MetricScore.of("ROC_AUC", 0.5).available()).isTrue();
    }

    @Test
    void trialKey_requiresBothParts() {
        assertThatThrownBy(() -> new TrialKey(null, "a")).isInstanceOf(IllegalArgumentException.class);
        assertThat(new TrialKey("d1", "a")).hasToString("a@d1");
    }

    @Test
    void trialResult_copiesMetricsAndDefaultsDuration() {
        Map<String, MetricScore> metrics = new HashMap<>();
        metrics.put("ROC_AUC", MetricScore.of("ROC_AUC", 0.8));
        TrialResult result = new TrialResult("d1", "a", TrialStatus.SUCCESS, null, metrics, null);
        metrics.clear();

        assertThat(result.duration()).isEqualTo(Duration.ZERO);
        assertThat(result.metricValue("ROC_AUC")).isEqualTo(0.8);
        assertThat(result.metricValue("PR_AUC")).isNaN();
        assertThat(result.key()).isEqualTo(new TrialKey("d1", "a"));
        assertThatThrownBy(() -> result.metrics().put("X", MetricScore.of("X", 1.0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void trialResult_factoriesSetStatus() {
        TrialKey key = new TrialKey("d1", "a");

        assertThat(TrialResult.datasetError(key, "missing").status()).isEqualTo(TrialStatus.DATASET_ERROR);
        assertThat(TrialResult.algorithmError(key, Duration.ofMillis(5), "boom").duration()).isEqualTo(Duration.ofMillis(5));
        assertThat(TrialResult.success(key, Duration.ZERO, Map.of()).isSuccess()).isTrue();
    }
}
