package com.quoteflow.schema;

public enum FieldType {
    TEXT,
    BOOLEAN,
    ENUMERATED
}
