package org.nowstart.tseval.metric;

import org.springframework.stereotype.Component;

@Component
public class RocAucMetric extends AbstractScoreMetric {

    public static final String NAME = "ROC_AUC";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected double compute(double[] scores, int[] labels) {
        RankingCurve curve = RankingCurve.of(scores, labels);
        if (curve.positives() == 0 || curve.negatives() == 0) {
            throw new IllegalArgumentException("Only one class present in labels. ROC AUC score is not defined in that case.");
        }

        double area = 0.0;
        double prevFpr = 0.0;
        double prevTpr = 0.0;
        for (int k = 0; k < curve.size(); k++) {
            double fpr = (double) curve.falsePositives(k) / curve.negatives();
            double tpr = (double) curve.truePositives(k) / curve.positives();
            area += (fpr - prevFpr) * (tpr + prevTpr) / 2.0;
            prevFpr = fpr;
            prevTpr = tpr;
        }
        return area;
    }
}
