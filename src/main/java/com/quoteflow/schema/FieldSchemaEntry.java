package com.quoteflow.schema;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldSchemaEntry(
        String name,
        List<String> sectionPath,
        FieldType type,
        List<String> options,
        String defaultValue,
        String description,
        List<String> positiveIndicators,
        List<String> synonyms) {

    public static final String YES = "YES";
    public static final String NO = "NO";

    public FieldSchemaEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("field name must not be blank");
        }
        type = type == null ? FieldType.TEXT : type;
        sectionPath = sectionPath == null ? List.of() : List.copyOf(sectionPath);
        options = type == FieldType.BOOLEAN
                ? List.of(YES, NO)
                : options == null ? List.of() : List.copyOf(options);
        if (type == FieldType.ENUMERATED && options.isEmpty()) {
            throw new IllegalArgumentException("enumerated field " + name + " declares no options");
        }
        description = description == null ? "" : description;
        positiveIndicators = positiveIndicators == null ? List.of() : List.copyOf(positiveIndicators);
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
        if (defaultValue == null) {
            defaultValue = type == FieldType.BOOLEAN ? NO : "";
        }
    }

    public static FieldSchemaEntry text(String name, List<String> sectionPath, String description) {
        return new FieldSchemaEntry(name, sectionPath, FieldType.TEXT, null, null, description, null, null);
    }

    public static FieldSchemaEntry checkbox(String name, List<String> sectionPath, String description, List<String> positiveIndicators) {
        return new FieldSchemaEntry(name, sectionPath, FieldType.BOOLEAN, null, null, description, positiveIndicators, null);
    }

    public static FieldSchemaEntry choice(String name, List<String> sectionPath, String description, List<String> options) {
        return new FieldSchemaEntry(name, sectionPath, FieldType.ENUMERATED, options, null, description, null, null);
    }

    /**
     * The value a field falls back to when nothing trustworthy was extracted.
     */
    public String emptyValue() {
        return type == FieldType.BOOLEAN ? NO : "";
    }

    public Optional<String> canonicalOption(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        String trimmed = candidate.strip();
        return options.stream()
                .filter(option -> option.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    public String sectionKey() {
        return String.join(" > ", sectionPath);
    }

    /**
     * Field name as words, e.g. {@code barcode_scanner_check} becomes "barcode scanner".
     */
    public String humanizedName() {
        return name.replaceAll("_check$", "")
                .replace('_', ' ')
                .strip()
                .toLowerCase(Locale.ROOT);
    }
}
