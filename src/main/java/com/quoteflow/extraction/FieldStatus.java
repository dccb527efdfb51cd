package com.quoteflow.extraction;

public enum FieldStatus {
    EXTRACTED,
    LOW_CONFIDENCE,
    ZERO_EVIDENCE,
    UNRESOLVED;

    public boolean needsReview() {
        return this == ZERO_EVIDENCE || this == UNRESOLVED;
    }
}
