package com.quoteflow.feedback;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.quoteflow.embedding.LocalModelEmbeddingService;
import com.quoteflow.examples.ExampleStore;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CurationSchedulerTest {

    @Test
    void shouldRunPassesUntilClosed() throws Exception {
        CountDownLatch passes = new CountDownLatch(2);
        QualityCurator curator = new QualityCurator(new ExampleStore(), new LocalModelEmbeddingService(32), 5, 0.3) {
            @Override
            public CurationReport curate() {
                passes.countDown();
                return super.curate();
            }
        };

        try (CurationScheduler scheduler = new CurationScheduler(curator, 10)) {
            scheduler.start();
            assertTrue(passes.await(5, TimeUnit.SECONDS));
            scheduler.close();
            assertTrue(scheduler.isStopped());
        }
    }

    @Test
    void shouldSurviveFailingPass() {
        QualityCurator failing = new QualityCurator(new ExampleStore(), new LocalModelEmbeddingService(32), 5, 0.3) {
            @Override
            public CurationReport curate() {
                throw new IllegalStateException("store unavailable");
            }
        };

        try (CurationScheduler scheduler = new CurationScheduler(failing, 1000)) {
            assertDoesNotThrow(scheduler::runOnce);
        }
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        QualityCurator curator = new QualityCurator(new ExampleStore(), new LocalModelEmbeddingService(32), 5, 0.3);

        assertThrows(IllegalArgumentException.class, () -> new CurationScheduler(curator, 0));
    }
}
