package org.nowstart.tseval.service;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.tseval.data.dto.MetricScore;
import org.nowstart.tseval.data.exception.ConfigException;
import org.nowstart.tseval.data.property.EvaluationProperties;
import org.nowstart.tseval.metric.Metric;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScoringService {

    private final List<Metric> metrics;
    private final EvaluationProperties evaluationProperties;
    private List<Metric> activeMetrics = List.of();

    @PostConstruct
    public void init() {
        Map<String, Metric> byName = new HashMap<>();
        for (Metric metric : metrics) {
            String name = normalize(metric.name());
            if (byName.put(name, metric) != null) {
                throw new IllegalStateException("Duplicate metric registered for name=" + name);
            }
        }

        List<Metric> resolved = new ArrayList<>();
        for (String configured : evaluationProperties.metrics()) {
            Metric metric = byName.get(normalize(configured));
            if (metric == null) {
                throw new ConfigException("Unknown metric: " + configured + ", available=" + byName.keySet());
            }
            if (!resolved.contains(metric)) {
                resolved.add(metric);
            }
        }
        activeMetrics = List.copyOf(resolved);
    }

    public List<String> metricNames() {
        return activeMetrics.stream().map(Metric::name).toList();
    }

    /**
     * Scores every active metric. A failing metric is reported as unavailable instead of failing the others.
     */
    public Map<String, MetricScore> score(double[] scores, int[] labels) {
        Map<String, MetricScore> out = new LinkedHashMap<>();
        for (Metric metric : activeMetrics) {
            out.put(metric.name(), scoreOne(metric, scores, labels));
        }
        return out;
    }

    private MetricScore scoreOne(Metric metric, double[] scores, int[] labels) {
        try {
            double value = metric.score(scores, labels);
            if (!Double.isFinite(value)) {
                return MetricScore.unavailable(metric.name(), "metric returned " + value);
            }
            return MetricScore.of(metric.name(), value);
        } catch (RuntimeException e) {
            return MetricScore.unavailable(metric.name(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigException("metric name is required");
        }
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
