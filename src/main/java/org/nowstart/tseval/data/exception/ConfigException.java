package org.nowstart.tseval.data.exception;

public class ConfigException extends EvaluationException {

    public ConfigException(String message) {
        super("config_error", message);
    }

    public ConfigException(String message, Throwable cause) {
        super("config_error", message, cause);
    }
}
