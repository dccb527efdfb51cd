package com.quoteflow.feedback;

public enum FeedbackType {
    CORRECTION,
    CONFIRMATION,
    REJECTION;

    /**
     * Same value (ignoring surrounding whitespace) confirms, a blank correction rejects, anything
     * else corrects.
     */
    public static FeedbackType derive(String originalValue, String correctedValue) {
        String original = originalValue == null ? "" : originalValue.strip();
        String corrected = correctedValue == null ? "" : correctedValue.strip();
        if (original.equals(corrected)) {
            return CONFIRMATION;
        }
        if (corrected.isEmpty()) {
            return REJECTION;
        }
        return CORRECTION;
    }
}
