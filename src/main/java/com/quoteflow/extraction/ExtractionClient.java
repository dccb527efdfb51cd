package com.quoteflow.extraction;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.quoteflow.runtime.ServiceUnavailableException;
import com.quoteflow.schema.Batch;
import com.quoteflow.schema.FieldSchemaEntry;

/**
 * Calls the model for one batch and turns the answer into validated field values.
 *
 * <p>An invalid answer gets exactly one repair call listing the violations. Fields still invalid
 * after the repair fall back to their empty value and are flagged low confidence. A batch whose
 * calls keep failing after retries comes back {@link BatchExtraction#failed failed}; the client
 * never throws for a single batch.
 */
public class ExtractionClient {
    private static final Logger log = LoggerFactory.getLogger(ExtractionClient.class);

    private final LlmExtractionService service;
    private final PromptAssembler assembler;
    private final RetryPolicy retryPolicy;
    private final long timeoutMs;
    private final LlmResponseParser parser = new LlmResponseParser();
    private final ResponseValidator validator = new ResponseValidator();

    public ExtractionClient(LlmExtractionService service, PromptAssembler assembler, RetryPolicy retryPolicy, long timeoutMs) {
        this.service = service;
        this.assembler = assembler;
        this.retryPolicy = retryPolicy;
        this.timeoutMs = timeoutMs;
    }

    public BatchExtraction extract(Batch batch, String prompt) {
        ValidationResult first;
        try {
            first = validateAnswer(batch, call(batch, prompt, false));
        } catch (ServiceUnavailableException e) {
            log.error("extraction.batch.failed batch={} fields={} reason={}", batch.id(), batch.size(), e.getMessage());
            return BatchExtraction.failed(batch, e.getMessage());
        }
        if (first.valid()) {
            return BatchExtraction.succeeded(batch, first.values(), Set.of());
        }

        log.warn("extraction.response.invalid batch={} invalidFields={} violations={}",
                batch.id(), first.invalid().size(), first.violations());
        Map<String, String> values = new LinkedHashMap<>(first.values());
        try {
            ValidationResult repaired = validateAnswer(batch, call(batch, assembler.repair(prompt, first.violations()), true));
            values.putAll(repaired.values());
            if (!repaired.valid()) {
                log.warn("extraction.repair.invalid batch={} invalidFields={}", batch.id(), repaired.invalid().size());
            }
        } catch (ServiceUnavailableException e) {
            log.warn("extraction.repair.failed batch={} reason={}", batch.id(), e.getMessage());
        }

        Map<String, String> complete = new LinkedHashMap<>();
        Set<String> lowConfidence = new LinkedHashSet<>();
        for (FieldSchemaEntry entry : batch.fields()) {
            String value = values.get(entry.name());
            if (value == null) {
                complete.put(entry.name(), entry.emptyValue());
                lowConfidence.add(entry.name());
            } else {
                complete.put(entry.name(), value);
            }
        }
        return BatchExtraction.succeeded(batch, complete, lowConfidence);
    }

    private ValidationResult validateAnswer(Batch batch, String raw) {
        return parser.parse(raw)
                .map(object -> validator.validate(object, batch))
                .orElseGet(() -> validator.unparsable(batch));
    }

    private String call(Batch batch, String prompt, boolean repair) {
        ExtractionRequest request = new ExtractionRequest(batch.id(), prompt, batch.fieldNames(), repair);
        return retryPolicy.execute("extraction " + batch.id(), () -> callWithTimeout(request));
    }

    private String callWithTimeout(ExtractionRequest request) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> future = executor.submit(() -> service.complete(request));
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ServiceUnavailableException(
                    "LLM call for " + request.batchId() + " timed out after " + timeoutMs + " ms", true, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ServiceUnavailableException unavailable) {
                throw unavailable;
            }
            throw new ServiceUnavailableException("LLM call for " + request.batchId() + " failed", false, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("LLM call for " + request.batchId() + " interrupted", false, e);
        } finally {
            executor.shutdownNow();
        }
    }
}
