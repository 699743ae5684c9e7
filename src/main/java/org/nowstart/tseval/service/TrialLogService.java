package org.nowstart.tseval.service;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tseval.data.dto.MetricScore;
import org.nowstart.tseval.data.dto.TrialKey;
import org.nowstart.tseval.data.dto.TrialResult;
import org.nowstart.tseval.data.type.TrialState;
import org.nowstart.tseval.data.type.TrialStatus;
import org.nowstart.tseval.result.ResultsStore;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class TrialLogService {

    public void logTransition(TrialKey key, TrialState state) {
        log.debug("event=trial_state dataset={} algorithm={} state={}", key.datasetId(), key.algorithmName(), state);
    }

    public void logTrialDone(TrialResult result) {
        log.info(
                "event=trial_done dataset={} algorithm={} status={} duration_sec={} metrics={}",
                result.datasetId(),
                result.algorithmName(),
                result.status(),
                formatSeconds(result.duration()),
                formatMetrics(result.metrics())
        );
        for (MetricScore score : result.metrics().values()) {
            if (!score.available()) {
                log.warn(
                        "event=metric_unavailable dataset={} algorithm={} metric={} reason=\"{}\"",
                        result.datasetId(),
                        result.algorithmName(),
                        score.name(),
                        escape(score.reason())
                );
            }
        }
    }

    public void logTrialFailed(TrialResult result, Throwable cause) {
        log.warn(
                "event=trial_failed dataset={} algorithm={} status={} duration_sec={} error=\"{}\"",
                result.datasetId(),
                result.algorithmName(),
                result.status(),
                formatSeconds(result.duration()),
                escape(result.errorMessage())
        );
        log.debug("event=trial_failed_cause dataset={} algorithm={}", result.datasetId(), result.algorithmName(), cause);
    }

    public void logRunSummary(EvaluationPlan plan, ResultsStore store, Duration elapsed) {
        Map<TrialStatus, Long> byStatus = store.rows().stream()
                .collect(Collectors.groupingBy(TrialResult::status, Collectors.counting()));
        log.info(
                "event=run_done datasets={} algorithms={} trials={} rows={} success={} algorithm_error={} dataset_error={} elapsed_sec={}",
                plan.datasetIds().size(),
                plan.algorithms().size(),
                plan.trialCount(),
                store.size(),
                byStatus.getOrDefault(TrialStatus.SUCCESS, 0L),
                byStatus.getOrDefault(TrialStatus.ALGORITHM_ERROR, 0L),
                byStatus.getOrDefault(TrialStatus.DATASET_ERROR, 0L),
                formatSeconds(elapsed)
        );
    }

    private String formatMetrics(Map<String, MetricScore> metrics) {
        return metrics.values().stream()
                .map(score -> score.name() + "=" + (score.available() ? formatValue(score.value()) : "n/a"))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private String formatValue(double value) {
        return String.format(Locale.US, "%.4f", value);
    }

    private String formatSeconds(Duration duration) {
        return String.format(Locale.US, "%.3f", duration.toNanos() / 1_000_000_000.0);
    }

    private String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\"", "\\\"").replaceAll("\\s+", " ");
    }
}
