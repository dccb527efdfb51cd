package com.quoteflow.extraction;

/**
 * Narrow seam to the external language model.
 *
 * <p>Implementations return the raw model text. They throw
 * {@link com.quoteflow.runtime.ServiceUnavailableException} when the service cannot answer;
 * {@code isTransientFailure()} tells the caller whether a retry makes sense.
 */
public interface LlmExtractionService {
    String complete(ExtractionRequest request);

    String modelName();
}
