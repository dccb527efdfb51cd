package com.quoteflow.examples;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExampleTest {

    @Test
    void shouldClampConfidenceIntoUnitInterval() {
        Example high = Example.candidate("filling", "default", "psi", "ctx", "80 PSI", 1.7, null, ExampleSource.SEED);
        Example low = Example.candidate("filling", "default", "psi", "ctx", "80 PSI", -0.2, null, ExampleSource.SEED);

        assertEquals(1.0, high.confidenceScore());
        assertEquals(0.0, low.confidenceScore());
    }

    @Test
    void shouldRejectMoreSuccessesThanUses() {
        assertThrows(IllegalArgumentException.class, () -> new Example("id", "filling", "default", "psi", "ctx", "80 PSI",
                0.5, 1, 2, Instant.now(), null, null, ExampleSource.SEED, false, 0L));
    }

    @Test
    void shouldTreatUnusedExampleAsNeutral() {
        Example example = Example.candidate("filling", "default", "psi", "ctx", "80 PSI", 0.9, null, ExampleSource.SEED);

        assertEquals(0.5, example.successRate());
        assertEquals(0.7, ExampleRanking.quality(example), 1e-9);
    }

    @Test
    void shouldHashEquivalentContextsIdentically() {
        assertEquals(ContextHash.of("Monoblock  Filler\n480V"), ContextHash.of("monoblock filler 480v"));
    }

    @Test
    void shouldGrowUsageWhenSuccessWouldExceedIt() {
        Example example = Example.candidate("filling", "default", "psi", "ctx", "80 PSI", 0.9, null, ExampleSource.SEED)
                .withId("e1");

        Example afterSuccess = example.withFeedback(true);

        assertEquals(1, afterSuccess.usageCount());
        assertEquals(1, afterSuccess.successCount());
        assertEquals(example.version() + 1, afterSuccess.version());
    }
}
