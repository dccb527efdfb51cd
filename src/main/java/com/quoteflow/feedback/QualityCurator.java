package com.quoteflow.feedback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.quoteflow.embedding.EmbeddingService;
import com.quoteflow.embedding.Vectors;
import com.quoteflow.examples.Example;
import com.quoteflow.examples.ExampleStore;
import com.quoteflow.runtime.AppConfig;
import com.quoteflow.runtime.ServiceUnavailableException;

/**
 * One curation pass over the store: deprioritizes examples that keep failing and fills in
 * embeddings that could not be computed when the example was created. Nothing is deleted.
 */
public class QualityCurator {
    private static final Logger log = LoggerFactory.getLogger(QualityCurator.class);

    private final ExampleStore store;
    private final EmbeddingService embeddingService;
    private final int minUsage;
    private final double successRateFloor;

    public QualityCurator(ExampleStore store, EmbeddingService embeddingService, int minUsage, double successRateFloor) {
        this.store = store;
        this.embeddingService = embeddingService;
        this.minUsage = minUsage;
        this.successRateFloor = successRateFloor;
    }

    public static QualityCurator from(ExampleStore store, EmbeddingService embeddingService, AppConfig.LearningConfig learning) {
        return new QualityCurator(store, embeddingService, learning.getCurationMinUsage(), learning.getCurationSuccessRateFloor());
    }

    public CurationReport curate() {
        int scanned = 0;
        int deprioritized = 0;
        int backfilled = 0;
        int failures = 0;
        boolean embeddingAvailable = true;

        for (Example example : store.scan()) {
            scanned++;
            if (example.deprioritized()) {
                continue;
            }
            if (example.usageCount() >= minUsage && example.successRate() < successRateFloor) {
                if (store.deprioritize(example.id())) {
                    deprioritized++;
                    log.info("curation.deprioritized id={} field={} usage={} successRate={}",
                            example.id(), example.fieldName(), example.usageCount(),
                            String.format("%.2f", example.successRate()));
                }
                continue;
            }
            if (embeddingAvailable && Vectors.isEmpty(example.embedding())) {
                try {
                    store.updateEmbedding(example.id(), embeddingService.embed(example.inputContext()));
                    backfilled++;
                } catch (ServiceUnavailableException e) {
                    failures++;
                    embeddingAvailable = false;
                    log.warn("curation.embedding.unavailable id={} reason={}; skipping remaining backfill",
                            example.id(), e.getMessage());
                }
            }
        }

        store.flush();
        CurationReport report = new CurationReport(scanned, deprioritized, backfilled, failures);
        log.info("curation.done scanned={} deprioritized={} backfilled={} embeddingFailures={}",
                scanned, deprioritized, backfilled, failures);
        return report;
    }
}
