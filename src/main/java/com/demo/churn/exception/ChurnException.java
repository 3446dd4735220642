package com.demo.churn.exception;

/** Base type for failures raised by the scoring engine. */
public class ChurnException extends RuntimeException {

    public ChurnException(String message) {
        super(message);
    }

    public ChurnException(String message, Throwable cause) {
        super(message, cause);
    }
}
