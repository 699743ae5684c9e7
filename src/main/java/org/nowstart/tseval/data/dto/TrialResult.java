package org.nowstart.tseval.data.dto;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.nowstart.tseval.data.type.TrialStatus;

public record TrialResult(
        String datasetId,
        String algorithmName,
        TrialStatus status,
        Duration duration,
        Map<String, MetricScore> metrics,
        String errorMessage
) {

    public TrialResult {
        Objects.requireNonNull(datasetId, "datasetId is required");
        Objects.requireNonNull(algorithmName, "algorithmName is required");
        Objects.requireNonNull(status, "status is required");
        duration = duration != null ? duration : Duration.ZERO;
        metrics = metrics != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metrics)) : Map.of();
    }

    public static TrialResult success(TrialKey key, Duration duration, Map<String, MetricScore> metrics) {
        return new TrialResult(key.datasetId(), key.algorithmName(), TrialStatus.SUCCESS, duration, metrics, null);
    }

    public static TrialResult algorithmError(TrialKey key, Duration duration, String errorMessage) {
        return new TrialResult(key.datasetId(), key.algorithmName(), TrialStatus.ALGORITHM_ERROR, duration, Map.of(), errorMessage);
    }

    public static TrialResult datasetError(TrialKey key, String errorMessage) {
        return new TrialResult(key.datasetId(), key.algorithmName(), TrialStatus.DATASET_ERROR, Duration.ZERO, Map.of(), errorMessage);
    }

    public TrialKey key() {
        return new TrialKey(datasetId, algorithmName);
    }

    public boolean isSuccess() {
        return status == TrialStatus.SUCCESS;
    }

    public double metricValue(String metricName) {
        MetricScore score = metrics.get(metricName);
        return score != null && score.available() ? score.value() : Double.NaN;
    }
}
