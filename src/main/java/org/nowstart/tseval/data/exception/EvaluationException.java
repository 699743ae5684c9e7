package org.nowstart.tseval.data.exception;

import lombok.Getter;

@Getter
public class EvaluationException extends RuntimeException {

    private final String code;

    public EvaluationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public EvaluationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
