package org.nowstart.tseval.data.exception;

public class AlgorithmInvocationException extends EvaluationException {

    public AlgorithmInvocationException(String message) {
        super("algorithm_error", message);
    }

    public AlgorithmInvocationException(String message, Throwable cause) {
        super("algorithm_error", message, cause);
    }
}
