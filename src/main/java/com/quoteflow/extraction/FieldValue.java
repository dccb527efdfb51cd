package com.quoteflow.extraction;

import com.quoteflow.schema.FieldSchemaEntry;
import com.quoteflow.schema.FieldType;

/**
 * Field value tagged with its schema type. Booleans always hold {@code YES} or {@code NO}.
 */
public record FieldValue(FieldType type, String text) {
    public FieldValue {
        type = type == null ? FieldType.TEXT : type;
        text = text == null ? "" : text;
        if (type == FieldType.BOOLEAN && !FieldSchemaEntry.YES.equals(text) && !FieldSchemaEntry.NO.equals(text)) {
            throw new IllegalArgumentException("boolean value must be YES or NO, got: " + text);
        }
    }

    public static FieldValue empty(FieldSchemaEntry entry) {
        return new FieldValue(entry.type(), entry.emptyValue());
    }

    public static FieldValue of(FieldSchemaEntry entry, String text) {
        return new FieldValue(entry.type(), text);
    }

    /**
     * True for {@code YES} and for any non-blank text or option.
     */
    public boolean isAsserted() {
        if (type == FieldType.BOOLEAN) {
            return FieldSchemaEntry.YES.equals(text);
        }
        return !text.isBlank();
    }
}
