package org.nowstart.tseval.data.type;

public enum TrialStatus {
    SUCCESS,
    ALGORITHM_ERROR,
    DATASET_ERROR
}
