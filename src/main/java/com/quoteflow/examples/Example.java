package com.quoteflow.examples;

import java.time.Instant;

/**
 * Immutable snapshot of a stored extraction example. Counter changes produce a new snapshot
 * with {@code version + 1}; the store swaps snapshots with compare-and-set.
 */
public record Example(
        String id,
        String domainCategory,
        String variant,
        String fieldName,
        String inputContext,
        String expectedOutput,
        double confidenceScore,
        int usageCount,
        int successCount,
        Instant createdAt,
        float[] embedding,
        String contextHash,
        ExampleSource source,
        boolean deprioritized,
        long version) {

    public Example {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("fieldName must not be blank");
        }
        if (usageCount < 0 || successCount < 0) {
            throw new IllegalArgumentException("counters must be >= 0");
        }
        if (successCount > usageCount) {
            throw new IllegalArgumentException(
                    "successCount " + successCount + " exceeds usageCount " + usageCount + " for " + fieldName);
        }
        if (Double.isNaN(confidenceScore)) {
            confidenceScore = 0.0;
        }
        confidenceScore = Math.max(0.0, Math.min(1.0, confidenceScore));
        inputContext = inputContext == null ? "" : inputContext;
        expectedOutput = expectedOutput == null ? "" : expectedOutput;
        createdAt = createdAt == null ? Instant.now() : createdAt;
        embedding = embedding == null ? new float[0] : embedding;
        contextHash = contextHash == null || contextHash.isBlank() ? ContextHash.of(inputContext) : contextHash;
        source = source == null ? ExampleSource.SEED : source;
    }

    public static Example candidate(
            String domainCategory,
            String variant,
            String fieldName,
            String inputContext,
            String expectedOutput,
            double confidenceScore,
            float[] embedding,
            ExampleSource source) {
        return new Example(null, domainCategory, variant, fieldName, inputContext, expectedOutput,
                confidenceScore, 0, 0, Instant.now(), embedding, null, source, false, 0L);
    }

    public double successRate() {
        if (usageCount == 0) {
            return 0.5;
        }
        return (double) successCount / usageCount;
    }

    Example withId(String newId) {
        return new Example(newId, domainCategory, variant, fieldName, inputContext, expectedOutput, confidenceScore,
                usageCount, successCount, createdAt, embedding, contextHash, source, deprioritized, version);
    }

    Example withUsageRecorded() {
        return new Example(id, domainCategory, variant, fieldName, inputContext, expectedOutput, confidenceScore,
                usageCount + 1, successCount, createdAt, embedding, contextHash, source, deprioritized, version + 1);
    }

    Example withFeedback(boolean success) {
        if (!success) {
            return new Example(id, domainCategory, variant, fieldName, inputContext, expectedOutput, confidenceScore,
                    usageCount, successCount, createdAt, embedding, contextHash, source, deprioritized, version + 1);
        }
        int usage = successCount + 1 > usageCount ? usageCount + 1 : usageCount;
        return new Example(id, domainCategory, variant, fieldName, inputContext, expectedOutput, confidenceScore,
                usage, successCount + 1, createdAt, embedding, contextHash, source, deprioritized, version + 1);
    }

    Example withDeprioritized() {
        return new Example(id, domainCategory, variant, fieldName, inputContext, expectedOutput, confidenceScore,
                usageCount, successCount, createdAt, embedding, contextHash, source, true, version + 1);
    }

    Example withEmbedding(float[] newEmbedding) {
        return new Example(id, domainCategory, variant, fieldName, inputContext, expectedOutput, confidenceScore,
                usageCount, successCount, createdAt, newEmbedding, contextHash, source, deprioritized, version + 1);
    }
}
