package com.quoteflow.embedding;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private EmbeddingServices() {
    }

    public static EmbeddingService fromEnvironment(OkHttpClient httpClient, int dimension) {
        String endpoint = System.getenv("QUOTEFLOW_EMBEDDING_URL");
        if (endpoint == null || endpoint.isBlank()) {
            return new LocalModelEmbeddingService(dimension);
        }
        String provider = System.getenv().getOrDefault("QUOTEFLOW_EMBEDDING_PROVIDER", "custom");
        String apiKey = System.getenv("QUOTEFLOW_EMBEDDING_API_KEY");
        return new ExternalProviderEmbeddingService(httpClient, endpoint, provider, apiKey, dimension);
    }
}
