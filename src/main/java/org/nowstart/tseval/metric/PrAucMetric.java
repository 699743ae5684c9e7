package org.nowstart.tseval.metric;

import org.springframework.stereotype.Component;

@Component
public class PrAucMetric extends AbstractScoreMetric {

    public static final String NAME = "PR_AUC";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected double compute(double[] scores, int[] labels) {
        RankingCurve curve = RankingCurve.of(scores, labels);
        curve.requirePositives(NAME);

        // the curve starts at recall 0 with precision 1
        double area = 0.0;
        double prevRecall = 0.0;
        double prevPrecision = 1.0;
        int last = curve.fullRecallIndex();
        for (int k = 0; k <= last; k++) {
            double recall = curve.recall(k);
            double precision = curve.precision(k);
            area += (recall - prevRecall) * (precision + prevPrecision) / 2.0;
            prevRecall = recall;
            prevPrecision = precision;
        }
        return area;
    }
}
