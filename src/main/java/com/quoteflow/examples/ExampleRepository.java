package com.quoteflow.examples;

import java.util.Collection;
import java.util.List;

import com.quoteflow.runtime.PersistenceException;

/**
 * Durable backing for the {@link ExampleStore}. Implementations report failures as
 * {@link PersistenceException}.
 */
public interface ExampleRepository {
    List<Example> loadAll();

    void saveAll(Collection<Example> examples);

    static ExampleRepository inMemory() {
        return new ExampleRepository() {
            @Override
            public List<Example> loadAll() {
                return List.of();
            }

            @Override
            public void saveAll(Collection<Example> examples) {
            }
        };
    }
}
