package com.quoteflow.feedback;

import java.util.Map;

/**
 * Snapshot of example store health for monitoring.
 *
 * @param successRate overall successes over overall uses, 0 when nothing was used yet
 */
public record QualityStats(
        int totalExamples,
        double successRate,
        double avgConfidence,
        Map<String, FieldQuality> perFieldBreakdown,
        Map<QualityTier, Integer> tierDistribution,
        int deprioritizedCount) {

    public record FieldQuality(int examples, int usageCount, int successCount, double successRate, double avgConfidence) {
    }
}
