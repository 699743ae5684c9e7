package org.nowstart.tseval.data.exception;

import lombok.Getter;

@Getter
public class UnknownDatasetException extends EvaluationException {

    private final String datasetId;

    public UnknownDatasetException(String datasetId) {
        super("unknown_dataset", "No dataset registered for id=" + datasetId);
        this.datasetId = datasetId;
    }
}
