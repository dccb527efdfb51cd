package com.quoteflow.extraction;

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.quoteflow.runtime.ServiceUnavailableException;

/**
 * Bounded retries with exponential backoff for transient service failures. Non-transient
 * failures are rethrown immediately.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxRetries;
    private final long initialBackoffMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, long initialBackoffMs) {
        this(maxRetries, initialBackoffMs, Thread::sleep);
    }

    public RetryPolicy(int maxRetries, long initialBackoffMs, Sleeper sleeper) {
        this.maxRetries = Math.max(0, maxRetries);
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
        this.sleeper = sleeper;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        int maxAttempts = maxRetries + 1;
        ServiceUnavailableException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (ServiceUnavailableException e) {
                last = e;
                if (!e.isTransientFailure() || attempt == maxAttempts) {
                    break;
                }
                long backoff = backoffFor(attempt);
                log.warn("retry operation={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        operation, attempt, maxAttempts, backoff, e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new ServiceUnavailableException(operation + " interrupted during backoff", false, interrupted);
                }
            }
        }
        throw last;
    }

    long backoffFor(int attempt) {
        return initialBackoffMs * (1L << Math.min(attempt - 1, 20));
    }

    public int maxRetries() {
        return maxRetries;
    }
}
