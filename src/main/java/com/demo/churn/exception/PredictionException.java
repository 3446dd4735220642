package com.demo.churn.exception;

public class PredictionException extends ChurnException {

    public PredictionException(String message) {
        super(message);
    }

    public PredictionException(String message, Throwable cause) {
        super(message, cause);
    }
}
