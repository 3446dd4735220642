package com.demo.churn.service.batch;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/** Handle of one batch run: progress, cancellation and, once done, the report. */
public class BatchJob {

    public enum Status { RUNNING, COMPLETED, CANCELLED, FAILED }

    @Getter
    private final String id;
    @Getter
    private final int total;
    @Getter
    private final Instant createdAt;

    private final AtomicInteger done = new AtomicInteger();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final CompletableFuture<BatchReport> completion = new CompletableFuture<>();

    BatchJob(String id, int total, Instant createdAt) {
        this.id = id;
        this.total = total;
        this.createdAt = createdAt;
    }

    public int getDone() {
        return done.get();
    }

    public double getPercentComplete() {
        return total == 0 ? 100.0 : Math.min(100.0, 100.0 * done.get() / total);
    }

    /**
     * Stops launching rows. Rows already being scored finish and appear in the report;
     * the others are reported as skipped.
     *
     * @return false when the job had already finished
     */
    public boolean cancel() {
        if (completion.isDone()) return false;
        return cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public Status getStatus() {
        if (!completion.isDone()) return Status.RUNNING;
        if (completion.isCompletedExceptionally()) return Status.FAILED;
        return completion.join().isCancelled() ? Status.CANCELLED : Status.COMPLETED;
    }

    public boolean isFinished() {
        return completion.isDone();
    }

    /** The report, or null while the job runs. */
    public BatchReport getReport() {
        return completion.isDone() && !completion.isCompletedExceptionally() ? completion.join() : null;
    }

    public CompletableFuture<BatchReport> completion() {
        return completion;
    }

    int advance() {
        return done.incrementAndGet();
    }
}
