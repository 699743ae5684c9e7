package org.nowstart.tseval.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.nowstart.tseval.data.dto.MetricScore;
import org.nowstart.tseval.data.dto.TrialKey;
import org.nowstart.tseval.data.dto.TrialResult;
import org.nowstart.tseval.data.type.TrialStatus;

class ResultsStoreTest {

    @Test
    void append_overwritesSameKeyInPlace() {
        ResultsStore store = new ResultsStore();
        store.append(success("d1", "a", 0.1));
        store.append(success("d1", "b", 0.2));

        store.append(success("d1", "a", 0.9));

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.rows()).extracting(TrialResult::algorithmName).containsExactly("a", "b");
        assertThat(store.get(new TrialKey("d1", "a")).orElseThrow().metricValue("ROC_AUC")).isEqualTo(0.9);
    }

    @Test
    void reserve_fixesExportOrderRegardlessOfAppendOrder() {
        ResultsStore store = new ResultsStore();
        store.reserve(new TrialKey("d1", "a"));
        store.reserve(new TrialKey("d1", "b"));
        store.reserve(new TrialKey("d2", "a"));

        store.append(success("d2", "a", 0.3));
        store.append(success("d1", "b", 0.2));

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.get(new TrialKey("d1", "a"))).isEmpty();
        assertThat(store.rows()).extracting(TrialResult::key)
                .containsExactly(new TrialKey("d1", "b"), new TrialKey("d2", "a"));

        store.append(success("d1", "a", 0.1));

        assertThat(store.rows()).extracting(TrialResult::key).containsExactly(
                new TrialKey("d1", "a"),
                new TrialKey("d1", "b"),
                new TrialKey("d2", "a")
        );
    }

    @Test
    void filterAndGroupBy_returnUnmodifiableViews() {
        ResultsStore store = new ResultsStore();
        store.append(success("d1", "a", 0.5));
        store.append(TrialResult.algorithmError(new TrialKey("d1", "b"), Duration.ofMillis(3), "boom"));
        store.append(TrialResult.datasetError(new TrialKey("d2", "a"), "missing file"));

        assertThat(store.filter(result -> result.status() == TrialStatus.ALGORITHM_ERROR))
                .extracting(TrialResult::algorithmName)
                .containsExactly("b");
        Map<String, List<TrialResult>> byAlgorithm = store.groupByAlgorithm();
        assertThat(byAlgorithm.keySet()).containsExactly("a", "b");
        assertThat(byAlgorithm.get("a")).hasSize(2);
        assertThat(store.groupByDataset().keySet()).containsExactly("d1", "d2");

        assertThatThrownBy(() -> byAlgorithm.put("c", List.of())).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> byAlgorithm.get("a").clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> store.rows().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void export_unionsMetricColumnsAndBlanksUnavailable() {
        ResultsStore store = new ResultsStore();
        store.append(TrialResult.success(new TrialKey("d1", "a"), Duration.ofMillis(1500), Map.of(
                "ROC_AUC", MetricScore.of("ROC_AUC", 0.75)
        )));
        store.append(TrialResult.success(new TrialKey("d2", "a"), Duration.ZERO, Map.of(
                "ROC_AUC", MetricScore.unavailable("ROC_AUC", "Only one class present")
        )));
        store.append(TrialResult.algorithmError(new TrialKey("d3", "a"), Duration.ZERO, "boom"));

        ResultsTable table = store.export();

        assertThat(table.columns()).containsExactly("dataset", "algorithm", "status", "duration", "ROC_AUC", "error");
        assertThat(table.size()).isEqualTo(3);
        ResultRow first = table.rows().get(0);
        assertThat(first.durationSeconds()).isEqualTo(1.5);
        assertThat(first.metrics()).containsEntry("ROC_AUC", 0.75);
        assertThat(table.rows().get(1).metrics()).containsEntry("ROC_AUC", null);
        assertThat(table.rows().get(2).metrics()).containsEntry("ROC_AUC", null);
        assertThat(table.rows().get(2).error()).isEqualTo("boom");
    }

    @Test
    void append_isSafeUnderConcurrentWriters() throws Exception {
        ResultsStore store = new ResultsStore();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                int n = i;
                futures.add(executor.submit(() -> store.append(success("d" + (n % 50), "a", n))));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(store.size()).isEqualTo(50);
        assertThat(store.rows()).extracting(TrialResult::datasetId).doesNotHaveDuplicates();
    }

    private TrialResult success(String dataset, String algorithm, double auc) {
        return TrialResult.success(
                new TrialKey(dataset, algorithm),
                Duration.ofMillis(10),
                Map.of("ROC_AUC", MetricScore.of("ROC_AUC", auc))
        );
    }
}
