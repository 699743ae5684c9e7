package org.nowstart.tseval.metric;

import org.springframework.stereotype.Component;

@Component
public class AveragePrecisionMetric extends AbstractScoreMetric {

    public static final String NAME = "AVERAGE_PRECISION";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected double compute(double[] scores, int[] labels) {
        RankingCurve curve = RankingCurve.of(scores, labels);
        curve.requirePositives(NAME);

        double ap = 0.0;
        double prevRecall = 0.0;
        int last = curve.fullRecallIndex();
        for (int k = 0; k <= last; k++) {
            double recall = curve.recall(k);
            ap += (recall - prevRecall) * curve.precision(k);
            prevRecall = recall;
        }
        return ap;
    }
}
