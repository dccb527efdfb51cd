package com.quoteflow.extraction;

import java.util.Map;
import java.util.Set;

import com.quoteflow.schema.Batch;

/**
 * Validated values for one batch. A failed batch carries no values; its fields are reported as
 * unresolved by the engine.
 */
public record BatchExtraction(
        Batch batch,
        Map<String, String> values,
        Set<String> lowConfidence,
        boolean failed,
        String failureReason) {

    public BatchExtraction {
        values = Map.copyOf(values);
        lowConfidence = Set.copyOf(lowConfidence);
    }

    public static BatchExtraction succeeded(Batch batch, Map<String, String> values, Set<String> lowConfidence) {
        return new BatchExtraction(batch, values, lowConfidence, false, null);
    }

    public static BatchExtraction failed(Batch batch, String reason) {
        return new BatchExtraction(batch, Map.of(), Set.of(), true, reason);
    }
}
