package com.quoteflow.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.quoteflow.embedding.EmbeddingService;
import com.quoteflow.evidence.ConfidenceEstimator;
import com.quoteflow.evidence.EvidenceCorpus;
import com.quoteflow.evidence.EvidenceVerifier;
import com.quoteflow.examples.ExampleStore;
import com.quoteflow.extraction.BatchExtraction;
import com.quoteflow.extraction.ExtractionClient;
import com.quoteflow.extraction.FieldMap;
import com.quoteflow.extraction.FieldResult;
import com.quoteflow.extraction.FieldStatus;
import com.quoteflow.extraction.FieldValue;
import com.quoteflow.extraction.LlmExtractionService;
import com.quoteflow.extraction.PromptAssembler;
import com.quoteflow.extraction.RetryPolicy;
import com.quoteflow.extraction.SourceWindowSelector;
import com.quoteflow.feedback.CurationReport;
import com.quoteflow.feedback.FeedbackLog;
import com.quoteflow.feedback.FeedbackRecord;
import com.quoteflow.feedback.FeedbackRecorder;
import com.quoteflow.feedback.QualityCurator;
import com.quoteflow.feedback.QualityStats;
import com.quoteflow.feedback.QualityStatsCalculator;
import com.quoteflow.postprocess.FieldDependencyValidator;
import com.quoteflow.postprocess.FieldSuggestion;
import com.quoteflow.postprocess.PostProcessingEngine;
import com.quoteflow.retrieval.RetrievalSettings;
import com.quoteflow.retrieval.RetrievedExample;
import com.quoteflow.retrieval.SimilarityRetriever;
import com.quoteflow.runtime.AppConfig;
import com.quoteflow.schema.Batch;
import com.quoteflow.schema.FieldSchema;
import com.quoteflow.schema.FieldSchemaEntry;
import com.quoteflow.schema.SchemaPartitioner;
import com.quoteflow.source.LineItem;
import com.quoteflow.source.SourceDocument;

/**
 * Entry point for extraction, feedback and quality monitoring. One instance per process, shared
 * by all callers; it owns the worker pool and holds the example store by reference.
 */
public class ExtractionEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExtractionEngine.class);

    private final AppConfig config;
    private final ExampleStore store;
    private final SimilarityRetriever retriever;
    private final SchemaPartitioner partitioner;
    private final PromptAssembler assembler;
    private final ExtractionClient client;
    private final EvidenceVerifier verifier;
    private final ConfidenceEstimator confidenceEstimator = new ConfidenceEstimator();
    private final FieldDependencyValidator dependencyValidator = new FieldDependencyValidator();
    private final FeedbackRecorder feedbackRecorder;
    private final QualityCurator curator;
    private final QualityStatsCalculator statsCalculator = new QualityStatsCalculator();
    private final ExecutorService workers;

    public ExtractionEngine(
            AppConfig config,
            ExampleStore store,
            EmbeddingService embeddingService,
            LlmExtractionService llmService,
            FeedbackLog feedbackLog) {
        this(config, store, embeddingService, llmService, feedbackLog,
                new RetryPolicy(config.getLlm().getMaxRetries(), config.getLlm().getInitialBackoffMs()));
    }

    public ExtractionEngine(
            AppConfig config,
            ExampleStore store,
            EmbeddingService embeddingService,
            LlmExtractionService llmService,
            FeedbackLog feedbackLog,
            RetryPolicy retryPolicy) {
        this.config = config;
        this.store = store;
        this.retriever = new SimilarityRetriever(store, embeddingService, RetrievalSettings.from(config.getRetrieval()));
        this.partitioner = new SchemaPartitioner(
                config.getPartition().getMaxFieldsPerBatch(), config.getPartition().getMaxPromptChars());
        this.assembler = new PromptAssembler(new SourceWindowSelector(config.getLlm().getMaxSourceChars()));
        this.client = new ExtractionClient(llmService, assembler, retryPolicy, config.getLlm().getTimeoutMs());
        this.verifier = EvidenceVerifier.from(config.getEvidence());
        this.feedbackRecorder = new FeedbackRecorder(store, embeddingService, feedbackLog, config.getLearning());
        this.curator = QualityCurator.from(store, embeddingService, config.getLearning());
        this.workers = Executors.newFixedThreadPool(Math.max(1, config.getWorkerThreads()), workerThreads());
    }

    /**
     * Extracts every schema field. Never throws for a failing batch or field: the worst outcome
     * for a field is an empty value with status {@link FieldStatus#UNRESOLVED}.
     */
    public FieldMap extractFields(String sourceText, List<LineItem> lineItems, FieldSchema schema, String category, String variant) {
        return submit(sourceText, lineItems, schema, category, variant).await();
    }

    public ExtractionJob submit(String sourceText, List<LineItem> lineItems, FieldSchema schema, String category, String variant) {
        SourceDocument document = new SourceDocument(sourceText, lineItems);
        String jobId = UUID.randomUUID().toString();
        long started = System.nanoTime();
        List<Batch> batches = partitioner.partition(schema);
        EvidenceCorpus corpus = EvidenceCorpus.of(document);
        String context = document.exampleContext();
        AtomicBoolean cancelled = new AtomicBoolean(false);
        AtomicInteger completed = new AtomicInteger();

        log.info("extraction.started job={} category={} variant={} fields={} batches={}",
                jobId, category, variant, schema.size(), batches.size());

        List<CompletableFuture<List<FieldResult>>> futures = new ArrayList<>(batches.size());
        for (Batch batch : batches) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return runBatch(batch, document, corpus, context, category, variant, cancelled);
                } finally {
                    completed.incrementAndGet();
                }
            }, workers));
        }

        CompletableFuture<FieldMap> result = CompletableFuture
                .allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<FieldResult> raw = new ArrayList<>(schema.size());
                    futures.forEach(future -> raw.addAll(future.join()));
                    FieldMap fields = finish(schema, raw, corpus, cancelled.get());
                    if (!cancelled.get()) {
                        try {
                            feedbackRecorder.harvest(fields, schema.entries(), context, category, variant);
                        } catch (RuntimeException e) {
                            log.warn("extraction.harvest.failed job={} reason={}", jobId, e.getMessage(), e);
                        }
                    }
                    store.flush();
                    log.info("extraction.done job={} fields={} unresolved={} zeroEvidence={} lowConfidence={} cancelled={} elapsedMs={}",
                            jobId,
                            fields.size(),
                            fields.withStatus(FieldStatus.UNRESOLVED).size(),
                            fields.withStatus(FieldStatus.ZERO_EVIDENCE).size(),
                            fields.withStatus(FieldStatus.LOW_CONFIDENCE).size(),
                            cancelled.get(),
                            (System.nanoTime() - started) / 1_000_000);
                    return fields;
                });
        return new ExtractionJob(jobId, batches.size(), cancelled, completed, result);
    }

    public FeedbackRecord recordFeedback(String fieldName, String context, String originalValue, String correctedValue) {
        return feedbackRecorder.recordFeedback(fieldName, context, originalValue, correctedValue);
    }

    public FeedbackRecord recordFeedback(
            String fieldName,
            String context,
            String originalValue,
            String correctedValue,
            String category,
            String variant,
            String exampleId) {
        return feedbackRecorder.recordFeedback(fieldName, context, originalValue, correctedValue, category, variant, exampleId);
    }

    public QualityStats getExtractionQualityStats() {
        return statsCalculator.compute(store.scan());
    }

    public CurationReport curate() {
        return curator.curate();
    }

    public QualityCurator curator() {
        return curator;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.getLlm().getTimeoutMs(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        store.flush();
    }

    private List<FieldResult> runBatch(
            Batch batch,
            SourceDocument document,
            EvidenceCorpus corpus,
            String context,
            String category,
            String variant,
            AtomicBoolean cancelled) {
        if (cancelled.get()) {
            log.info("extraction.batch.skipped batch={} fields={} reason=cancelled", batch.id(), batch.size());
            return unresolved(batch);
        }
        try {
            Map<String, List<RetrievedExample>> examples =
                    retriever.retrieveForFields(context, batch.fieldNames(), category, variant);
            String prompt = assembler.assemble(batch, document, examples);
            BatchExtraction extraction = client.extract(batch, prompt);
            if (extraction.failed()) {
                return unresolved(batch);
            }
            return verify(batch, extraction, corpus);
        } catch (RuntimeException e) {
            log.error("extraction.batch.failed batch={} fields={} reason={}", batch.id(), batch.size(), e.getMessage(), e);
            return unresolved(batch);
        }
    }

    private List<FieldResult> verify(Batch batch, BatchExtraction extraction, EvidenceCorpus corpus) {
        List<FieldResult> results = new ArrayList<>(batch.size());
        for (FieldSchemaEntry entry : batch.fields()) {
            String value = extraction.values().getOrDefault(entry.name(), entry.emptyValue());
            FieldValue fieldValue = FieldValue.of(entry, value);
            if (isSummaryField(entry.name())) {
                // derived from the selections during post-processing, nothing to verify
                results.add(new FieldResult(entry.name(), fieldValue, FieldStatus.EXTRACTED, false, batch.id(),
                        confidenceEstimator.estimate(entry, value, corpus)));
            } else if (extraction.lowConfidence().contains(entry.name())) {
                results.add(new FieldResult(entry.name(), fieldValue, FieldStatus.LOW_CONFIDENCE, false, batch.id(),
                        confidenceEstimator.estimate(entry, value, corpus)));
            } else if (fieldValue.isAsserted() && !verifier.isSupported(entry, value, corpus)) {
                log.info("extraction.zero-evidence batch={} field={}", batch.id(), entry.name());
                results.add(new FieldResult(entry.name(), FieldValue.empty(entry), FieldStatus.ZERO_EVIDENCE, false,
                        batch.id(), 0.0));
            } else {
                results.add(new FieldResult(entry.name(), fieldValue, FieldStatus.EXTRACTED, fieldValue.isAsserted(),
                        batch.id(), confidenceEstimator.estimate(entry, value, corpus)));
            }
        }
        return results;
    }

    private FieldMap finish(FieldSchema schema, List<FieldResult> raw, EvidenceCorpus corpus, boolean cancelled) {
        Map<String, FieldResult> byName = new LinkedHashMap<>();
        raw.forEach(result -> byName.put(result.fieldName(), result));

        Map<String, String> values = new LinkedHashMap<>();
        Set<String> locked = new HashSet<>();
        for (FieldSchemaEntry entry : schema.entries()) {
            FieldResult result = byName.get(entry.name());
            values.put(entry.name(), result.value().text());
            if (result.status().needsReview() && !isSummaryField(entry.name())) {
                locked.add(entry.name());
            }
        }

        Map<String, String> processed = PostProcessingEngine.forSchema(schema, config.getPostProcessing()).apply(values, locked);
        List<FieldSuggestion> suggestions = dependencyValidator.validate(processed);
        Set<String> capped = new HashSet<>();
        for (FieldSuggestion suggestion : suggestions) {
            if (suggestion.lowersConfidence()) {
                capped.add(suggestion.field());
            }
        }

        List<FieldResult> results = new ArrayList<>(schema.size());
        for (FieldSchemaEntry entry : schema.entries()) {
            FieldResult result = byName.get(entry.name());
            String value = processed.getOrDefault(entry.name(), result.value().text());
            if (!value.equals(result.value().text())) {
                FieldValue changed = FieldValue.of(entry, value);
                result = result.withValue(changed)
                        .withEvidence(changed.isAsserted() && verifier.isSupported(entry, value, corpus));
            }
            if (capped.contains(entry.name())) {
                result = result.withConfidence(Math.min(result.confidence(), FieldDependencyValidator.CONFIDENCE_CAP));
            }
            results.add(result);
        }
        return new FieldMap(results, suggestions, cancelled);
    }

    private boolean isSummaryField(String fieldName) {
        return fieldName.equals(config.getPostProcessing().getSummaryField());
    }

    private static List<FieldResult> unresolved(Batch batch) {
        List<FieldResult> results = new ArrayList<>(batch.size());
        for (FieldSchemaEntry entry : batch.fields()) {
            results.add(new FieldResult(entry.name(), FieldValue.empty(entry), FieldStatus.UNRESOLVED, false, batch.id(), 0.0));
        }
        return results;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "quoteflow-extract-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
