package com.quoteflow.postprocess;

/**
 * Advisory note about a field that looks inconsistent with another. Never applied automatically.
 */
public record FieldSuggestion(
        String field,
        String currentValue,
        String suggestedValue,
        String reason,
        Kind kind,
        boolean lowersConfidence) {

    public enum Kind {
        SUGGESTION,
        WARNING,
        INFO
    }
}
