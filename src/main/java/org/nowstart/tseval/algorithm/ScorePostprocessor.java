package org.nowstart.tseval.algorithm;

@FunctionalInterface
public interface ScorePostprocessor {

    ScorePostprocessor IDENTITY = scores -> scores;

    double[] apply(double[] scores);
}
