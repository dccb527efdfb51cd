package com.quoteflow.retrieval;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.quoteflow.embedding.EmbeddingService;
import com.quoteflow.embedding.LocalModelEmbeddingService;
import com.quoteflow.examples.Example;
import com.quoteflow.examples.ExampleSource;
import com.quoteflow.examples.ExampleStore;
import com.quoteflow.runtime.ServiceUnavailableException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimilarityRetrieverTest {
    private final EmbeddingService embeddings = new LocalModelEmbeddingService(256);

    @Test
    void shouldReturnNothingWhenFieldHasNoExamples() {
        SimilarityRetriever retriever = new SimilarityRetriever(new ExampleStore(), embeddings,
                new RetrievalSettings(2, 0.2, 0.7, 0.3));

        List<RetrievedExample> results = retriever.retrieve("Monoblock filler, 60 bottles per minute",
                "production_speed", "filling", "default");

        assertTrue(results.isEmpty());
    }

    @Test
    void shouldReturnAtMostKExamplesAboveMinimumSimilarity() {
        ExampleStore store = new ExampleStore();
        String context = "Monoblock piston filler with capping, 480V, 80 PSI air, Allen-Bradley PLC";
        for (int i = 0; i < 6; i++) {
            store.put(example(context + " variant " + i, "80 PSI"));
        }
        store.put(example("Stainless conveyor belt spare parts kit", "none"));
        double minSimilarity = 0.3;
        SimilarityRetriever retriever = new SimilarityRetriever(store, embeddings,
                new RetrievalSettings(2, minSimilarity, 0.7, 0.3));

        List<RetrievedExample> results = retriever.retrieve(context, "psi", "filling", "default");

        assertEquals(2, results.size());
        for (RetrievedExample result : results) {
            assertTrue(result.similarity() >= minSimilarity);
            assertEquals(1, store.get(result.example().id()).orElseThrow().usageCount());
        }
        assertTrue(results.get(0).score() >= results.get(1).score());
    }

    @Test
    void shouldCapExamplesPerFieldAtThree() {
        RetrievalSettings settings = new RetrievalSettings(10, 0.0, 0.7, 0.3);

        assertEquals(RetrievalSettings.MAX_EXAMPLES_PER_FIELD, settings.examplesPerField());
    }

    @Test
    void shouldSkipDeprioritizedAndUnembeddedExamples() {
        ExampleStore store = new ExampleStore();
        String context = "Labeler with barcode scanner";
        String deprioritized = store.put(example(context, "YES"));
        store.deprioritize(deprioritized);
        store.put(Example.candidate("filling", "default", "psi", context, "YES", 0.9, null, ExampleSource.SEED));
        SimilarityRetriever retriever = new SimilarityRetriever(store, embeddings, new RetrievalSettings(3, 0.0, 0.7, 0.3));

        assertTrue(retriever.retrieve(context, "psi", "filling", "default").isEmpty());
    }

    @Test
    void shouldDegradeToZeroShotWhenEmbeddingServiceIsDown() {
        ExampleStore store = new ExampleStore();
        store.put(example("Monoblock filler", "80 PSI"));
        EmbeddingService down = new EmbeddingService() {
            @Override
            public float[] embed(String text) {
                throw new ServiceUnavailableException("embedding service offline", true);
            }

            @Override
            public int dimension() {
                return 256;
            }
        };
        SimilarityRetriever retriever = new SimilarityRetriever(store, down, new RetrievalSettings(2, 0.0, 0.7, 0.3));

        Map<String, List<RetrievedExample>> results = retriever.retrieveForFields("Monoblock filler", List.of("psi"), "filling", "default");

        assertTrue(results.isEmpty());
    }

    private Example example(String context, String output) {
        return Example.candidate("filling", "default", "psi", context, output, 0.8, embeddings.embed(context), ExampleSource.SEED);
    }
}
