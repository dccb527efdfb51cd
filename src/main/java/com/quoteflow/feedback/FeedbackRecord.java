package com.quoteflow.feedback;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FeedbackRecord(
        String id,
        String fieldName,
        String originalPrediction,
        String correctedValue,
        FeedbackType feedbackType,
        Instant timestamp,
        String exampleId,
        String domainCategory,
        String variant,
        String createdExampleId) {
}
