package org.nowstart.tseval.metric;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

final class RankingCurve {

    private final double[] thresholds;
    private final int[] truePositives;
    private final int[] falsePositives;
    private final int positives;
    private final int negatives;

    private RankingCurve(double[] thresholds, int[] truePositives, int[] falsePositives, int positives, int negatives) {
        this.thresholds = thresholds;
        this.truePositives = truePositives;
        this.falsePositives = falsePositives;
        this.positives = positives;
        this.negatives = negatives;
    }

    static RankingCurve of(double[] scores, int[] labels) {
        int[] order = IntStream.range(0, scores.length)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> scores[i]).reversed())
                .mapToInt(Integer::intValue)
                .toArray();

        List<double[]> points = new ArrayList<>();
        int tp = 0;
        int fp = 0;
        for (int k = 0; k < order.length; k++) {
            int index = order[k];
            if (labels[index] == 1) {
                tp++;
            } else {
                fp++;
            }
            boolean lastOfThreshold = k == order.length - 1 || scores[order[k + 1]] != scores[index];
            if (lastOfThreshold) {
                points.add(new double[] {scores[index], tp, fp});
            }
        }

        double[] thresholds = new double[points.size()];
        int[] tps = new int[points.size()];
        int[] fps = new int[points.size()];
        for (int i = 0; i < points.size(); i++) {
            thresholds[i] = points.get(i)[0];
            tps[i] = (int) points.get(i)[1];
            fps[i] = (int) points.get(i)[2];
        }
        return new RankingCurve(thresholds, tps, fps, tp, fp);
    }

    int size() {
        return thresholds.length;
    }

    int truePositives(int k) {
        return truePositives[k];
    }

    int falsePositives(int k) {
        return falsePositives[k];
    }

    int positives() {
        return positives;
    }

    int negatives() {
        return negatives;
    }

    double precision(int k) {
        int predicted = truePositives[k] + falsePositives[k];
        return predicted == 0 ? 0.0 : (double) truePositives[k] / predicted;
    }

    double recall(int k) {
        return (double) truePositives[k] / positives;
    }

    /**
     * Index of the first threshold reaching full recall.
     */
    int fullRecallIndex() {
        for (int k = 0; k < truePositives.length; k++) {
            if (truePositives[k] == positives) {
                return k;
            }
        }
        return truePositives.length - 1;
    }

    void requirePositives(String metricName) {
        if (positives == 0) {
            throw new IllegalArgumentException(metricName + " is not defined when labels contain no anomalies");
        }
    }
}
