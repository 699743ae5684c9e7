package org.nowstart.tseval.algorithm;

import java.nio.file.Path;

/**
 * Detector that reads the dataset values from a CSV file, one row per time step.
 * The file only exists for the duration of the call.
 */
@FunctionalInterface
public interface FileDetector {

    double[] detect(Path datasetFile) throws Exception;
}
