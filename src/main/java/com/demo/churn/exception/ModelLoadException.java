package com.demo.churn.exception;

/**
 * The classifier artifact could not be read or does not match the feature schema.
 * No prediction can be served until this is resolved.
 */
public class ModelLoadException extends ChurnException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
