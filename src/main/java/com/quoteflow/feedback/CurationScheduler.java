package com.quoteflow.feedback;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link QualityCurator#curate()} on a fixed delay until closed. A failing pass is logged and
 * the next one still runs.
 */
public class CurationScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CurationScheduler.class);

    private final QualityCurator curator;
    private final long intervalMs;
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "quoteflow-curation");
        thread.setDaemon(true);
        return thread;
    });

    public CurationScheduler(QualityCurator curator, long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.curator = curator;
        this.intervalMs = intervalMs;
    }

    public void start() {
        executor.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("curation.scheduler.started intervalMs={}", intervalMs);
    }

    void runOnce() {
        try {
            curator.curate();
        } catch (RuntimeException e) {
            log.error("curation.pass.failed reason={}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        log.info("curation.scheduler.stopped");
    }

    public boolean isStopped() {
        return executor.isShutdown();
    }
}
