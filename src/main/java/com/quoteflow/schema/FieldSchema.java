package com.quoteflow.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable field schema for one template variant.
 */
public final class FieldSchema {
    private final String variant;
    private final List<FieldSchemaEntry> entries;
    private final Map<String, FieldSchemaEntry> byName;

    public FieldSchema(String variant, List<FieldSchemaEntry> entries) {
        this.variant = variant;
        this.entries = List.copyOf(entries);
        Map<String, FieldSchemaEntry> index = new LinkedHashMap<>();
        for (FieldSchemaEntry entry : this.entries) {
            if (index.putIfAbsent(entry.name(), entry) != null) {
                throw new IllegalArgumentException("Duplicate field in schema " + variant + ": " + entry.name());
            }
        }
        this.byName = index;
    }

    public String variant() {
        return variant;
    }

    public List<FieldSchemaEntry> entries() {
        return entries;
    }

    public Optional<FieldSchemaEntry> field(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    public int size() {
        return entries.size();
    }
}
