package org.nowstart.tseval.metric;

public interface Metric {

    String name();

    /**
     * @param scores anomaly scores, one per time step
     * @param labels ground truth, 0 or 1 per time step
     * @throws IllegalArgumentException when the inputs cannot be scored (length mismatch, single class, ...)
     */
    double score(double[] scores, int[] labels);
}
