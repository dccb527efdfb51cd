package com.quoteflow.extraction;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.quoteflow.runtime.ServiceUnavailableException;
import com.quoteflow.schema.Batch;
import com.quoteflow.schema.FieldSchemaEntry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExtractionClientTest {
    private static final RetryPolicy NO_WAIT = new RetryPolicy(2, 10, millis -> {
    });

    private final Batch batch = new Batch("batch-001", 0, List.of(
            FieldSchemaEntry.text("voltage", List.of("Utilities"), "Supply voltage"),
            FieldSchemaEntry.text("psi", List.of("Utilities"), "Air pressure"),
            FieldSchemaEntry.checkbox("barcode_scanner_check", List.of("Options"), "", List.of("barcode"))), 0);
    private final PromptAssembler assembler = new PromptAssembler(new SourceWindowSelector(10_000));

    @Test
    void shouldReturnValuesFromValidAnswer() {
        ScriptedLlmService llm = new ScriptedLlmService()
                .answer("{\"voltage\": \"480V\", \"psi\": \"80\", \"barcode_scanner_check\": \"YES\"}");

        BatchExtraction result = client(llm, NO_WAIT).extract(batch, "prompt");

        assertFalse(result.failed());
        assertEquals("480V", result.values().get("voltage"));
        assertEquals("YES", result.values().get("barcode_scanner_check"));
        assertTrue(result.lowConfidence().isEmpty());
        assertEquals(1, llm.requests.size());
        assertEquals(List.of("voltage", "psi", "barcode_scanner_check"), llm.requests.get(0).fieldNames());
    }

    @Test
    void shouldRepairOnceAndMergeAnswers() {
        ScriptedLlmService llm = new ScriptedLlmService()
                .answer("{\"voltage\": \"480V\", \"barcode_scanner_check\": \"maybe\"}")
                .answer("{\"psi\": \"80\", \"barcode_scanner_check\": \"NO\"}");

        BatchExtraction result = client(llm, NO_WAIT).extract(batch, "prompt");

        assertEquals(2, llm.requests.size());
        ExtractionRequest repair = llm.requests.get(1);
        assertTrue(repair.repair());
        assertTrue(repair.prompt().startsWith("prompt"));
        assertTrue(repair.prompt().contains("YOUR PREVIOUS ANSWER WAS REJECTED"));
        assertTrue(repair.prompt().contains("missing key 'psi'"));
        assertEquals("480V", result.values().get("voltage"));
        assertEquals("80", result.values().get("psi"));
        assertEquals("NO", result.values().get("barcode_scanner_check"));
        assertTrue(result.lowConfidence().isEmpty());
    }

    @Test
    void shouldFlagFieldsStillInvalidAfterRepair() {
        ScriptedLlmService llm = new ScriptedLlmService()
                .answer("not json at all")
                .answer("{\"voltage\": \"480V\", \"barcode_scanner_check\": [\"YES\"]}");

        BatchExtraction result = client(llm, NO_WAIT).extract(batch, "prompt");

        assertFalse(result.failed());
        assertEquals(2, llm.requests.size());
        assertEquals("480V", result.values().get("voltage"));
        assertEquals("", result.values().get("psi"));
        assertEquals("NO", result.values().get("barcode_scanner_check"));
        assertEquals(Set.of("psi", "barcode_scanner_check"), result.lowConfidence());
    }

    @Test
    void shouldRetryTransientFailures() {
        ScriptedLlmService llm = new ScriptedLlmService()
                .fail(new ServiceUnavailableException("HTTP 429", true))
                .fail(new ServiceUnavailableException("HTTP 503", true))
                .answer("{\"voltage\": \"\", \"psi\": \"\", \"barcode_scanner_check\": \"NO\"}");

        BatchExtraction result = client(llm, NO_WAIT).extract(batch, "prompt");

        assertFalse(result.failed());
        assertEquals(3, llm.requests.size());
    }

    @Test
    void shouldFailBatchWhenRetriesAreExhausted() {
        ScriptedLlmService llm = new ScriptedLlmService()
                .fail(new ServiceUnavailableException("HTTP 503", true))
                .fail(new ServiceUnavailableException("HTTP 503", true))
                .fail(new ServiceUnavailableException("HTTP 503", true));

        BatchExtraction result = client(llm, NO_WAIT).extract(batch, "prompt");

        assertTrue(result.failed());
        assertTrue(result.values().isEmpty());
        assertEquals("HTTP 503", result.failureReason());
    }

    @Test
    void shouldFailBatchOnUnexpectedServiceError() {
        ScriptedLlmService llm = new ScriptedLlmService().fail(new IllegalArgumentException("boom"));

        BatchExtraction result = client(llm, NO_WAIT).extract(batch, "prompt");

        assertTrue(result.failed());
        assertEquals(1, llm.requests.size());
    }

    @Test
    void shouldTreatSlowCallsAsTimeouts() {
        ScriptedLlmService llm = new ScriptedLlmService()
                .answerAfter(2_000, "{\"voltage\": \"480V\"}");
        ExtractionClient client = new ExtractionClient(llm, assembler, new RetryPolicy(0, 0, millis -> {
        }), 50);

        BatchExtraction result = client.extract(batch, "prompt");

        assertTrue(result.failed());
        assertTrue(result.failureReason().contains("timed out"));
    }

    private ExtractionClient client(LlmExtractionService llm, RetryPolicy policy) {
        return new ExtractionClient(llm, assembler, policy, 5_000);
    }
}
