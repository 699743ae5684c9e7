package org.nowstart.tseval.service;

import org.springframework.stereotype.Component;

@Component
public class ScoreScaler {

    public double[] minMaxScale(double[] scores) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : scores) {
            if (Double.isFinite(value)) {
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
        }

        double[] out = scores.clone();
        if (min > max) {
            return out;
        }
        double range = max - min;
        for (int i = 0; i < out.length; i++) {
            if (Double.isFinite(out[i])) {
                out[i] = range == 0.0 ? 0.0 : (out[i] - min) / range;
            }
        }
        return out;
    }
}
