package org.nowstart.tseval.metric;

public abstract class AbstractScoreMetric implements Metric {

    @Override
    public final double score(double[] scores, int[] labels) {
        if (scores == null || labels == null) {
            throw new IllegalArgumentException("scores and labels are required");
        }
        if (scores.length != labels.length) {
            throw new IllegalArgumentException(
                    "Found input variables with inconsistent numbers of samples: scores=" + scores.length
                            + ", labels=" + labels.length
            );
        }
        if (scores.length == 0) {
            throw new IllegalArgumentException("Cannot score an empty series");
        }
        return compute(sanitize(scores), labels);
    }

    protected abstract double compute(double[] scores, int[] labels);

    private double[] sanitize(double[] scores) {
        double[] out = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            double value = scores[i];
            if (Double.isNaN(value) || value == Double.NEGATIVE_INFINITY) {
                out[i] = 0.0;
            } else if (value == Double.POSITIVE_INFINITY) {
                out[i] = 1.0;
            } else {
                out[i] = value;
            }
        }
        return out;
    }
}
