package com.quoteflow.feedback;

public record CurationReport(int scanned, int deprioritized, int embeddingsBackfilled, int embeddingFailures) {
}
