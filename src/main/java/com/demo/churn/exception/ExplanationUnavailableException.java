package com.demo.churn.exception;

/** Exact attribution could not be computed; callers degrade to the approximate method. */
public class ExplanationUnavailableException extends ChurnException {

    public ExplanationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
