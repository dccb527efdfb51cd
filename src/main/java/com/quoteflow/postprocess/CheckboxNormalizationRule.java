package com.quoteflow.postprocess;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.quoteflow.schema.FieldSchema;
import com.quoteflow.schema.FieldSchemaEntry;
import com.quoteflow.schema.FieldType;

/**
 * Upper-cases checkbox values; anything other than yes or no becomes {@code NO}.
 */
public class CheckboxNormalizationRule implements PostProcessingRule {
    private final FieldSchema schema;

    public CheckboxNormalizationRule(FieldSchema schema) {
        this.schema = schema;
    }

    @Override
    public String name() {
        return "checkbox-normalization";
    }

    @Override
    public Map<String, String> apply(Map<String, String> fields) {
        Map<String, String> out = new LinkedHashMap<>(fields);
        for (FieldSchemaEntry entry : schema.entries()) {
            if (entry.type() != FieldType.BOOLEAN || !out.containsKey(entry.name())) {
                continue;
            }
            String value = out.get(entry.name());
            String upper = value == null ? "" : value.strip().toUpperCase(Locale.ROOT);
            out.put(entry.name(), FieldSchemaEntry.YES.equals(upper) ? FieldSchemaEntry.YES : FieldSchemaEntry.NO);
        }
        return out;
    }
}
