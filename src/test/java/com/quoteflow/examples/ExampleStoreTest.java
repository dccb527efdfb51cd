package com.quoteflow.examples;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.quoteflow.runtime.PersistenceException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExampleStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRankByQualityThenRecency() {
        ExampleStore store = new ExampleStore();
        Instant now = Instant.now();
        store.put(example("old-strong", 0.9, 4, 4, now.minusSeconds(600)));
        store.put(example("weak", 0.4, 4, 1, now));
        store.put(example("new-strong", 0.9, 4, 4, now.minusSeconds(60)));

        List<Example> ranked = store.getByField("filling", "default", "production_speed", 10);

        assertEquals(List.of("new-strong", "old-strong", "weak"), ranked.stream().map(Example::id).toList());
        assertEquals(1, store.getByField("filling", "default", "production_speed", 1).size());
        assertTrue(store.getByField("capping", "default", "production_speed", 5).isEmpty());
    }

    @Test
    void shouldIgnoreUnknownIdsOnCounterUpdates() {
        ExampleStore store = new ExampleStore();

        store.recordUsage("missing");
        store.recordFeedback("missing", true);

        assertEquals(0, store.size());
    }

    @Test
    void shouldKeepSuccessAtMostUsageUnderConcurrentUpdates() throws Exception {
        ExampleStore store = new ExampleStore();
        String id = store.put(Example.candidate("filling", "default", "psi", "ctx", "80 PSI", 0.8, null, ExampleSource.SEED));
        int threads = 8;
        int iterations = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int worker = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < iterations; i++) {
                    if (worker % 2 == 0) {
                        store.recordUsage(id);
                    } else {
                        store.recordFeedback(id, true);
                    }
                    Example snapshot = store.get(id).orElseThrow();
                    assertTrue(snapshot.successCount() <= snapshot.usageCount());
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        Example result = store.get(id).orElseThrow();
        assertEquals(threads / 2 * iterations, result.successCount());
        assertTrue(result.usageCount() >= result.successCount());
        assertTrue(result.usageCount() <= threads * iterations);
        assertEquals((long) threads * iterations, result.version());
    }

    @Test
    void shouldExcludeDeprioritizedExamplesFromLookups() {
        ExampleStore store = new ExampleStore();
        String id = store.put(example("e1", 0.9, 0, 0, Instant.now()));

        assertTrue(store.deprioritize(id));

        assertTrue(store.getByField("filling", "default", "production_speed", 5).isEmpty());
        assertTrue(store.get(id).orElseThrow().deprioritized());
        assertEquals(1, store.scan().size());
    }

    @Test
    void shouldCreateOnlyOneExamplePerFieldAndContext() {
        ExampleStore store = new ExampleStore();
        Example first = Example.candidate("filling", "default", "production_speed", "Quote 42 monoblock", "60 units/min",
                0.85, null, ExampleSource.FEEDBACK);
        Example second = Example.candidate("filling", "default", "production_speed", "quote 42   MONOBLOCK", "70 units/min",
                0.85, null, ExampleSource.FEEDBACK);

        Optional<String> created = store.putIfNewContext(first);
        Optional<String> duplicate = store.putIfNewContext(second);

        assertTrue(created.isPresent());
        assertFalse(duplicate.isPresent());
        assertEquals(created, store.findByContext("production_speed", ContextHash.of("Quote 42 monoblock")).map(Example::id));
    }

    @Test
    void shouldPersistAndReloadThroughJsonRepository() {
        Path file = tempDir.resolve("store/examples.json");
        ExampleStore store = new ExampleStore(new JsonFileExampleRepository(file));
        String id = store.put(Example.candidate("filling", "default", "psi", "ctx", "80 PSI", 0.8,
                new float[] { 0.6f, 0.8f }, ExampleSource.SEED));
        store.recordUsage(id);

        assertTrue(store.flush());
        assertTrue(Files.exists(file));

        ExampleStore reloaded = new ExampleStore(new JsonFileExampleRepository(file));
        Example example = reloaded.get(id).orElseThrow();
        assertEquals(1, example.usageCount());
        assertEquals("80 PSI", example.expectedOutput());
        assertEquals(2, example.embedding().length);
        assertEquals(1, reloaded.getByField("filling", "default", "psi", 3).size());
    }

    @Test
    void shouldSkipUnreadableRecordAndKeepACopyOfTheFile() throws Exception {
        Path file = tempDir.resolve("examples.json");
        Files.writeString(file, "["
                + record("keep-me", 1, 1) + ","
                + record("broken", 1, 2)
                + "]");

        JsonFileExampleRepository repository = new JsonFileExampleRepository(file);
        ExampleStore store = new ExampleStore(repository);
        store.put(Example.candidate("filling", "default", "psi", "new ctx", "90 PSI", 0.8, null, ExampleSource.SEED));

        assertTrue(store.get("keep-me").isPresent());
        assertTrue(store.get("broken").isEmpty());
        assertTrue(Files.readString(repository.corruptCopy()).contains("\"broken\""));

        assertTrue(store.flush());
        ExampleStore reloaded = new ExampleStore(new JsonFileExampleRepository(file));
        assertTrue(reloaded.get("keep-me").isPresent());
        assertEquals(2, reloaded.size());
    }

    @Test
    void shouldNotOverwriteExamplesFileThatCouldNotBeLoaded() throws Exception {
        Path file = tempDir.resolve("examples.json");
        Files.writeString(file, "{\"not\": \"an array\"}");
        JsonFileExampleRepository repository = new JsonFileExampleRepository(file);
        List<Collection<Example>> saves = new ArrayList<>();
        ExampleRepository recording = new ExampleRepository() {
            @Override
            public List<Example> loadAll() {
                return repository.loadAll();
            }

            @Override
            public void saveAll(Collection<Example> examples) {
                saves.add(examples);
            }
        };

        ExampleStore store = new ExampleStore(recording);
        store.put(Example.candidate("filling", "default", "psi", "ctx", "80 PSI", 0.8, null, ExampleSource.SEED));

        assertFalse(store.flush());
        assertTrue(saves.isEmpty());
        assertEquals("{\"not\": \"an array\"}", Files.readString(repository.corruptCopy()));
        assertEquals(1, store.size());
    }

    @Test
    void shouldKeepLearningInMemoryWhenRepositoryFails() {
        ExampleRepository failing = new ExampleRepository() {
            @Override
            public List<Example> loadAll() {
                throw new PersistenceException("disk gone", new IOException("disk gone"));
            }

            @Override
            public void saveAll(Collection<Example> examples) {
                throw new PersistenceException("disk gone", new IOException("disk gone"));
            }
        };
        ExampleStore store = new ExampleStore(failing);

        String id = store.put(Example.candidate("filling", "default", "psi", "ctx", "80 PSI", 0.8, null, ExampleSource.SEED));

        assertFalse(store.flush());
        assertTrue(store.get(id).isPresent());
    }

    private static String record(String id, int usage, int success) {
        return "{\"id\":\"" + id + "\",\"domainCategory\":\"filling\",\"variant\":\"default\","
                + "\"fieldName\":\"psi\",\"inputContext\":\"context " + id + "\",\"expectedOutput\":\"80 PSI\","
                + "\"confidenceScore\":0.9,\"usageCount\":" + usage + ",\"successCount\":" + success + ","
                + "\"createdAt\":\"2026-01-01T00:00:00Z\",\"source\":\"SEED\",\"deprioritized\":false,\"version\":0}";
    }

    private static Example example(String id, double confidence, int usage, int success, Instant createdAt) {
        return new Example(id, "filling", "default", "production_speed", "context " + id, "60 units per minute",
                confidence, usage, success, createdAt, null, null, ExampleSource.SEED, false, 0L);
    }
}
