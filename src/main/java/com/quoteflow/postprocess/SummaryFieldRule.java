package com.quoteflow.postprocess;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.quoteflow.schema.FieldSchema;
import com.quoteflow.schema.FieldSchemaEntry;
import com.quoteflow.schema.FieldType;

/**
 * Rebuilds the summary field from scratch: the labels of every selected checkbox in schema
 * order, comma separated. Whatever the field held before is discarded.
 */
public class SummaryFieldRule implements PostProcessingRule {
    private final FieldSchema schema;
    private final String summaryField;

    public SummaryFieldRule(FieldSchema schema, String summaryField) {
        this.schema = schema;
        this.summaryField = summaryField;
    }

    @Override
    public String name() {
        return "summary-field";
    }

    @Override
    public Map<String, String> apply(Map<String, String> fields) {
        if (summaryField == null || !schema.contains(summaryField)) {
            return fields;
        }
        List<String> selected = new ArrayList<>();
        for (FieldSchemaEntry entry : schema.entries()) {
            if (entry.type() == FieldType.BOOLEAN && FieldSchemaEntry.YES.equals(fields.get(entry.name()))) {
                selected.add(label(entry));
            }
        }
        Map<String, String> out = new LinkedHashMap<>(fields);
        out.put(summaryField, String.join(", ", selected));
        return out;
    }

    private static String label(FieldSchemaEntry entry) {
        String description = entry.description().strip();
        return description.isEmpty() ? entry.humanizedName() : description;
    }
}
