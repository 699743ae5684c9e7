package org.nowstart.tseval.data.dto;

public record MetricScore(
        String name,
        double value,
        boolean available,
        String reason
) {

    public static MetricScore of(String name, double value) {
        return new MetricScore(name, value, true, null);
    }

    public static MetricScore unavailable(String name, String reason) {
        return new MetricScore(name, Double.NaN, false, reason);
    }
}
