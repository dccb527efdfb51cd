package com.quoteflow.extraction;

import java.util.List;

/**
 * One call to the language model: the assembled prompt for a batch plus the keys the answer
 * must contain.
 */
public record ExtractionRequest(String batchId, String prompt, List<String> fieldNames, boolean repair) {
    public ExtractionRequest {
        prompt = prompt == null ? "" : prompt;
        fieldNames = fieldNames == null ? List.of() : List.copyOf(fieldNames);
    }
}
