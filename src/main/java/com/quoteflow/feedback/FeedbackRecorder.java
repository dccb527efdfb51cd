package com.quoteflow.feedback;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.quoteflow.embedding.EmbeddingService;
import com.quoteflow.examples.ContextHash;
import com.quoteflow.examples.Example;
import com.quoteflow.examples.ExampleSource;
import com.quoteflow.examples.ExampleStore;
import com.quoteflow.extraction.FieldMap;
import com.quoteflow.extraction.FieldResult;
import com.quoteflow.extraction.FieldStatus;
import com.quoteflow.runtime.AppConfig;
import com.quoteflow.runtime.PersistenceException;
import com.quoteflow.runtime.ServiceUnavailableException;
import com.quoteflow.schema.FieldSchemaEntry;
import com.quoteflow.schema.FieldType;

/**
 * Turns user corrections and trustworthy extractions into examples.
 *
 * <p>A field never gets two examples for the same input context: both feedback and harvesting
 * check {@code (fieldName, contextHash)} before creating one.
 */
public class FeedbackRecorder {
    private static final Logger log = LoggerFactory.getLogger(FeedbackRecorder.class);
    static final int MIN_HARVEST_TEXT_LENGTH = 3;

    private final ExampleStore store;
    private final EmbeddingService embeddingService;
    private final FeedbackLog feedbackLog;
    private final AppConfig.LearningConfig learning;

    public FeedbackRecorder(
            ExampleStore store,
            EmbeddingService embeddingService,
            FeedbackLog feedbackLog,
            AppConfig.LearningConfig learning) {
        this.store = store;
        this.embeddingService = embeddingService;
        this.feedbackLog = feedbackLog;
        this.learning = learning;
    }

    public FeedbackRecord recordFeedback(String fieldName, String context, String originalValue, String correctedValue) {
        return recordFeedback(fieldName, context, originalValue, correctedValue, "", "", null);
    }

    public FeedbackRecord recordFeedback(
            String fieldName,
            String context,
            String originalValue,
            String correctedValue,
            String category,
            String variant,
            String exampleId) {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("fieldName must not be blank");
        }
        FeedbackType type = FeedbackType.derive(originalValue, correctedValue);

        String originatingId = resolveOriginatingExample(fieldName, category, variant, exampleId).orElse(null);
        if (originatingId != null) {
            store.recordFeedback(originatingId, type == FeedbackType.CONFIRMATION);
        }

        String createdId = null;
        if (type == FeedbackType.CORRECTION) {
            createdId = createIfNew(category, variant, fieldName, context, correctedValue.strip(),
                    learning.getFeedbackConfidence(), ExampleSource.FEEDBACK).orElse(null);
        }

        FeedbackRecord record = new FeedbackRecord(
                UUID.randomUUID().toString(),
                fieldName,
                originalValue == null ? "" : originalValue,
                correctedValue == null ? "" : correctedValue,
                type,
                Instant.now(),
                originatingId,
                category,
                variant,
                createdId);
        try {
            feedbackLog.append(record);
        } catch (PersistenceException e) {
            log.warn("feedback.log.failed field={} type={} reason={}", fieldName, type, e.getMessage());
        }
        store.flush();
        log.info("feedback.recorded field={} type={} example={} createdExample={}",
                fieldName, type, originatingId, createdId);
        return record;
    }

    /**
     * Stores verified, confident extractions as new examples.
     *
     * @return ids of the examples created
     */
    public List<String> harvest(FieldMap fields, Iterable<FieldSchemaEntry> schema, String context, String category, String variant) {
        List<String> created = new ArrayList<>();
        if (!learning.isHarvestEnabled()) {
            return created;
        }
        for (FieldSchemaEntry entry : schema) {
            Optional<FieldResult> maybeResult = fields.get(entry.name());
            if (maybeResult.isEmpty() || !harvestable(entry, maybeResult.get())) {
                continue;
            }
            createIfNew(category, variant, entry.name(), context, maybeResult.get().value().text().strip(),
                    learning.getHarvestConfidence(), ExampleSource.EXTRACTION)
                    .ifPresent(created::add);
        }
        if (!created.isEmpty()) {
            store.flush();
            log.info("feedback.harvested category={} variant={} examples={}", category, variant, created.size());
        }
        return created;
    }

    private boolean harvestable(FieldSchemaEntry entry, FieldResult result) {
        if (!result.evidenceBacked()
                || result.status() != FieldStatus.EXTRACTED
                || result.confidence() < learning.getHarvestConfidenceFloor()) {
            return false;
        }
        String value = result.value().text().strip();
        if (entry.type() == FieldType.BOOLEAN) {
            return FieldSchemaEntry.YES.equals(value);
        }
        return value.length() >= MIN_HARVEST_TEXT_LENGTH;
    }

    private Optional<String> resolveOriginatingExample(String fieldName, String category, String variant, String exampleId) {
        if (exampleId != null && !exampleId.isBlank()) {
            if (store.get(exampleId).isPresent()) {
                return Optional.of(exampleId);
            }
            log.warn("feedback.example.unknown id={} field={}", exampleId, fieldName);
        }
        return store.getByField(category, variant, fieldName, 1).stream().findFirst().map(Example::id);
    }

    private Optional<String> createIfNew(
            String category,
            String variant,
            String fieldName,
            String context,
            String value,
            double confidence,
            ExampleSource source) {
        String contextHash = ContextHash.of(context);
        if (store.findByContext(fieldName, contextHash).isPresent()) {
            log.debug("feedback.example.duplicate field={} contextHash={}", fieldName, contextHash);
            return Optional.empty();
        }
        Example candidate = Example.candidate(category, variant, fieldName, context, value, confidence,
                embed(context), source);
        return store.putIfNewContext(candidate);
    }

    private float[] embed(String context) {
        try {
            return embeddingService.embed(context);
        } catch (ServiceUnavailableException e) {
            log.warn("feedback.embedding.unavailable reason={}; example stored without embedding", e.getMessage());
            return new float[0];
        }
    }
}
