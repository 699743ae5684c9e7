package org.nowstart.tseval.data.exception;

public class DatasetReadException extends EvaluationException {

    public DatasetReadException(String message) {
        super("dataset_read_error", message);
    }

    public DatasetReadException(String message, Throwable cause) {
        super("dataset_read_error", message, cause);
    }
}
