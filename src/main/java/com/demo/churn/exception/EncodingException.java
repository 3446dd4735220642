package com.demo.churn.exception;

/** A validated record could not be turned into the classifier's input vector. */
public class EncodingException extends ChurnException {

    public EncodingException(String message) {
        super(message);
    }
}
