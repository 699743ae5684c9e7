package org.nowstart.tseval.algorithm;

@FunctionalInterface
public interface ArrayDetector {

    double[] detect(double[][] values) throws Exception;
}
