package com.quoteflow.engine;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import com.quoteflow.extraction.FieldMap;

/**
 * Handle on a running multi-batch extraction.
 *
 * <p>{@link #cancel()} stops batches that have not started yet; their fields come back
 * unresolved. Batches already running finish, and their results are kept.
 */
public final class ExtractionJob {
    private final String id;
    private final int batchCount;
    private final AtomicBoolean cancelled;
    private final AtomicInteger completedBatches;
    private final CompletableFuture<FieldMap> result;

    ExtractionJob(String id, int batchCount, AtomicBoolean cancelled, AtomicInteger completedBatches, CompletableFuture<FieldMap> result) {
        this.id = id;
        this.batchCount = batchCount;
        this.cancelled = cancelled;
        this.completedBatches = completedBatches;
        this.result = result;
    }

    public String id() {
        return id;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int batchCount() {
        return batchCount;
    }

    public int completedBatches() {
        return completedBatches.get();
    }

    public boolean isDone() {
        return result.isDone();
    }

    public CompletableFuture<FieldMap> result() {
        return result;
    }

    /**
     * Blocks until every batch has either finished or been skipped.
     */
    public FieldMap await() {
        try {
            return result.join();
        } catch (CompletionException | CancellationException e) {
            throw new IllegalStateException("extraction job " + id + " did not complete", e);
        }
    }
}
