package com.demo.churn.service.batch;

/** Notified from worker threads after each finished row; implementations must be thread-safe. */
@FunctionalInterface
public interface BatchProgressListener {

    BatchProgressListener NONE = (jobId, done, total) -> { };

    void onProgress(String jobId, int done, int total);
}
