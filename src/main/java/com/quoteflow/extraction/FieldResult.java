package com.quoteflow.extraction;

public record FieldResult(
        String fieldName,
        FieldValue value,
        FieldStatus status,
        boolean evidenceBacked,
        String batchId,
        double confidence) {

    public FieldResult {
        status = status == null ? FieldStatus.EXTRACTED : status;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public FieldResult withValue(FieldValue newValue) {
        return new FieldResult(fieldName, newValue, status, evidenceBacked, batchId, confidence);
    }

    public FieldResult withStatus(FieldStatus newStatus) {
        return new FieldResult(fieldName, value, newStatus, evidenceBacked, batchId, confidence);
    }

    public FieldResult withEvidence(boolean backed) {
        return new FieldResult(fieldName, value, status, backed, batchId, confidence);
    }

    public FieldResult withConfidence(double newConfidence) {
        return new FieldResult(fieldName, value, status, evidenceBacked, batchId, newConfidence);
    }
}
