package com.quoteflow.schema;

import java.util.List;

public record Batch(String id, int index, List<FieldSchemaEntry> fields, int estimatedPromptChars) {
    public Batch {
        fields = List.copyOf(fields);
    }

    public List<String> fieldNames() {
        return fields.stream().map(FieldSchemaEntry::name).toList();
    }

    public boolean contains(String fieldName) {
        return fields.stream().anyMatch(entry -> entry.name().equals(fieldName));
    }

    public int size() {
        return fields.size();
    }
}
