package com.quoteflow.feedback;

public enum QualityTier {
    EXCELLENT,
    GOOD,
    NEEDS_REVIEW;

    public static QualityTier of(double confidenceScore) {
        if (confidenceScore >= 0.9) {
            return EXCELLENT;
        }
        return confidenceScore >= 0.7 ? GOOD : NEEDS_REVIEW;
    }
}
