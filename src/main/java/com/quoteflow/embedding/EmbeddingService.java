package com.quoteflow.embedding;

import com.quoteflow.runtime.ServiceUnavailableException;

public interface EmbeddingService {
    /**
     * @throws ServiceUnavailableException when the backing provider cannot produce a vector
     */
    float[] embed(String text);

    int dimension();

    default String version() {
        return "legacy-v1";
    }
}
