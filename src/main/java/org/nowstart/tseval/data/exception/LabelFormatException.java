package org.nowstart.tseval.data.exception;

public class LabelFormatException extends EvaluationException {

    public LabelFormatException(String message) {
        super("label_format_error", message);
    }

    public LabelFormatException(String message, Throwable cause) {
        super("label_format_error", message, cause);
    }
}
