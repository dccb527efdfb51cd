package com.quoteflow.retrieval;

import com.quoteflow.runtime.AppConfig;

public record RetrievalSettings(int examplesPerField, double minSimilarity, double similarityWeight, double qualityWeight) {
    public static final int MAX_EXAMPLES_PER_FIELD = 3;

    public RetrievalSettings {
        if (examplesPerField < 0) {
            throw new IllegalArgumentException("examplesPerField must be >= 0");
        }
        examplesPerField = Math.min(examplesPerField, MAX_EXAMPLES_PER_FIELD);
    }

    public static RetrievalSettings from(AppConfig.RetrievalConfig config) {
        return new RetrievalSettings(
                config.getExamplesPerField(),
                config.getMinSimilarity(),
                config.getSimilarityWeight(),
                config.getQualityWeight());
    }
}
