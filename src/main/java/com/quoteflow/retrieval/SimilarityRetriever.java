package com.quoteflow.retrieval;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.quoteflow.embedding.EmbeddingService;
import com.quoteflow.embedding.Vectors;
import com.quoteflow.examples.Example;
import com.quoteflow.examples.ExampleRanking;
import com.quoteflow.examples.ExampleStore;
import com.quoteflow.runtime.ServiceUnavailableException;

public class SimilarityRetriever {
    private static final Logger log = LoggerFactory.getLogger(SimilarityRetriever.class);

    private final ExampleStore store;
    private final EmbeddingService embeddingService;
    private final RetrievalSettings settings;

    public SimilarityRetriever(ExampleStore store, EmbeddingService embeddingService, RetrievalSettings settings) {
        this.store = store;
        this.embeddingService = embeddingService;
        this.settings = settings;
    }

    public List<RetrievedExample> retrieve(String context, String fieldName, String category, String variant) {
        return retrieveForFields(context, List.of(fieldName), category, variant).getOrDefault(fieldName, List.of());
    }

    /**
     * Embeds the context once and selects up to {@code examplesPerField} examples per field.
     * Returned examples have their usage recorded. An unavailable embedding service yields no
     * examples, which leaves extraction zero-shot.
     */
    public Map<String, List<RetrievedExample>> retrieveForFields(
            String context,
            Collection<String> fieldNames,
            String category,
            String variant) {
        Map<String, List<RetrievedExample>> out = new LinkedHashMap<>();
        if (settings.examplesPerField() == 0 || fieldNames.isEmpty()) {
            return out;
        }

        float[] queryEmbedding;
        try {
            queryEmbedding = embeddingService.embed(context);
        } catch (ServiceUnavailableException e) {
            log.warn("retrieval.embedding.unavailable fields={} reason={}", fieldNames.size(), e.getMessage());
            return out;
        }

        for (String fieldName : fieldNames) {
            List<RetrievedExample> selected = rank(queryEmbedding, store.candidates(category, variant, fieldName));
            selected.forEach(result -> store.recordUsage(result.example().id()));
            if (!selected.isEmpty()) {
                out.put(fieldName, selected);
            }
        }
        return out;
    }

    private List<RetrievedExample> rank(float[] queryEmbedding, List<Example> candidates) {
        return candidates.stream()
                .filter(example -> !Vectors.isEmpty(example.embedding()))
                .map(example -> {
                    float similarity = Vectors.cosine(queryEmbedding, example.embedding());
                    double score = (similarity * settings.similarityWeight())
                            + (ExampleRanking.quality(example) * settings.qualityWeight());
                    return new RetrievedExample(example, similarity, score);
                })
                .filter(result -> result.similarity() >= settings.minSimilarity())
                .sorted(Comparator.comparingDouble(RetrievedExample::score).reversed()
                        .thenComparing(result -> result.example().createdAt(), Comparator.reverseOrder()))
                .limit(settings.examplesPerField())
                .toList();
    }
}
