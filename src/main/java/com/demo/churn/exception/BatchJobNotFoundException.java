package com.demo.churn.exception;

public class BatchJobNotFoundException extends ChurnException {

    public BatchJobNotFoundException(String jobId) {
        super("Batch job not found: " + jobId);
    }
}
