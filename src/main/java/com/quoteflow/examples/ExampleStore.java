package com.quoteflow.examples;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.quoteflow.runtime.PersistenceException;

/**
 * Keyed example storage with per-record optimistic updates.
 *
 * <p>Each example lives in its own {@link AtomicReference}; counter updates build a new snapshot
 * and retry the compare-and-set on contention. The per-scope id lists are copy-on-write, so
 * appends never block concurrent retrieval.
 */
public class ExampleStore {
    private static final Logger log = LoggerFactory.getLogger(ExampleStore.class);

    private final ConcurrentHashMap<String, AtomicReference<Example>> examples = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ScopeKey, CopyOnWriteArrayList<String>> scopeIndex = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> contextIndex = new ConcurrentHashMap<>();
    private final AtomicBoolean dirty = new AtomicBoolean(false);
    private final ExampleRepository repository;
    private final boolean loadFailed;

    public ExampleStore() {
        this(ExampleRepository.inMemory());
    }

    public ExampleStore(ExampleRepository repository) {
        this.repository = repository;
        boolean failed = false;
        try {
            List<Example> loaded = repository.loadAll();
            for (Example example : loaded) {
                index(example);
            }
            log.info("examples.loaded count={}", loaded.size());
        } catch (PersistenceException e) {
            failed = true;
            log.warn("examples.load.failed reason={}; continuing in memory, flushes are disabled", e.getMessage(), e);
        }
        this.loadFailed = failed;
    }

    public String put(Example example) {
        Example stored = withGeneratedId(example);
        index(stored);
        dirty.set(true);
        log.debug("examples.put id={} field={} category={} variant={} source={}",
                stored.id(), stored.fieldName(), stored.domainCategory(), stored.variant(), stored.source());
        return stored.id();
    }

    /**
     * Stores the example only when no example exists yet for its field and context hash. The
     * check and the insert are one atomic step.
     *
     * @return the new id, or empty when an example for that context already exists
     */
    public Optional<String> putIfNewContext(Example example) {
        Example stored = withGeneratedId(example);
        if (contextIndex.putIfAbsent(contextKey(stored.fieldName(), stored.contextHash()), stored.id()) != null) {
            return Optional.empty();
        }
        index(stored);
        dirty.set(true);
        log.debug("examples.put id={} field={} category={} variant={} source={}",
                stored.id(), stored.fieldName(), stored.domainCategory(), stored.variant(), stored.source());
        return Optional.of(stored.id());
    }

    public Optional<Example> get(String id) {
        AtomicReference<Example> ref = id == null ? null : examples.get(id);
        return ref == null ? Optional.empty() : Optional.of(ref.get());
    }

    public List<Example> getByField(String category, String variant, String fieldName, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return candidates(category, variant, fieldName).stream()
                .sorted(ExampleRanking.BY_QUALITY_THEN_RECENCY)
                .limit(limit)
                .toList();
    }

    /**
     * Active (not deprioritized) examples for one scope, unranked.
     */
    public List<Example> candidates(String category, String variant, String fieldName) {
        List<String> ids = scopeIndex.getOrDefault(new ScopeKey(category, variant, fieldName), new CopyOnWriteArrayList<>());
        List<Example> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            AtomicReference<Example> ref = examples.get(id);
            if (ref != null && !ref.get().deprioritized()) {
                out.add(ref.get());
            }
        }
        return out;
    }

    public Optional<Example> findByContext(String fieldName, String contextHash) {
        String id = contextIndex.get(contextKey(fieldName, contextHash));
        return id == null ? Optional.empty() : get(id);
    }

    public void recordUsage(String id) {
        if (update(id, Example::withUsageRecorded).isEmpty()) {
            log.warn("examples.usage.unknown id={}", id);
        }
    }

    public void recordFeedback(String id, boolean success) {
        if (update(id, example -> example.withFeedback(success)).isEmpty()) {
            log.warn("examples.feedback.unknown id={} success={}", id, success);
        }
    }

    public boolean deprioritize(String id) {
        return update(id, Example::withDeprioritized).isPresent();
    }

    public boolean updateEmbedding(String id, float[] embedding) {
        return update(id, example -> example.withEmbedding(embedding)).isPresent();
    }

    public List<Example> scan() {
        List<Example> snapshot = new ArrayList<>(examples.size());
        for (AtomicReference<Example> ref : examples.values()) {
            snapshot.add(ref.get());
        }
        return snapshot;
    }

    public int size() {
        return examples.size();
    }

    /**
     * Writes a snapshot through the repository when anything changed since the last flush. A store
     * whose initial load failed never writes, since the snapshot would replace examples it could
     * not read.
     *
     * @return false when nothing could be written; the in-memory state is kept
     */
    public boolean flush() {
        if (loadFailed) {
            log.warn("examples.flush.skipped reason=initial load failed pending={}", dirty.get());
            return false;
        }
        if (!dirty.getAndSet(false)) {
            return true;
        }
        try {
            repository.saveAll(scan());
            return true;
        } catch (PersistenceException e) {
            dirty.set(true);
            log.warn("examples.flush.failed reason={}", e.getMessage(), e);
            return false;
        }
    }

    private Optional<Example> update(String id, UnaryOperator<Example> change) {
        AtomicReference<Example> ref = id == null ? null : examples.get(id);
        if (ref == null) {
            return Optional.empty();
        }
        while (true) {
            Example current = ref.get();
            Example next = change.apply(current);
            if (ref.compareAndSet(current, next)) {
                dirty.set(true);
                return Optional.of(next);
            }
        }
    }

    private void index(Example example) {
        AtomicReference<Example> existing = examples.putIfAbsent(example.id(), new AtomicReference<>(example));
        if (existing != null) {
            existing.set(example);
            return;
        }
        scopeIndex.computeIfAbsent(
                new ScopeKey(example.domainCategory(), example.variant(), example.fieldName()),
                unused -> new CopyOnWriteArrayList<>())
                .add(example.id());
        contextIndex.putIfAbsent(contextKey(example.fieldName(), example.contextHash()), example.id());
    }

    private static Example withGeneratedId(Example example) {
        return example.id() == null || example.id().isBlank()
                ? example.withId(UUID.randomUUID().toString())
                : example;
    }

    private static String contextKey(String fieldName, String contextHash) {
        return fieldName + "|" + contextHash;
    }

    private record ScopeKey(String category, String variant, String fieldName) {
        ScopeKey {
            category = category == null ? "" : category.toLowerCase(Locale.ROOT);
            variant = variant == null ? "" : variant.toLowerCase(Locale.ROOT);
        }
    }
}
