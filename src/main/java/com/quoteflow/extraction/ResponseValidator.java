package com.quoteflow.extraction;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quoteflow.schema.Batch;
import com.quoteflow.schema.FieldSchemaEntry;

/**
 * Checks a parsed answer against the batch schema and coerces each value to its field type.
 */
public class ResponseValidator {
    private static final Logger log = LoggerFactory.getLogger(ResponseValidator.class);
    private static final Set<String> TRUE_WORDS = Set.of("yes", "true", "1", "y", "checked");
    private static final Set<String> FALSE_WORDS = Set.of("no", "false", "0", "n", "unchecked", "");

    public ValidationResult validate(ObjectNode response, Batch batch) {
        Map<String, String> values = new LinkedHashMap<>();
        Set<String> invalid = new LinkedHashSet<>();
        List<String> violations = new ArrayList<>();

        for (FieldSchemaEntry entry : batch.fields()) {
            JsonNode node = response.get(entry.name());
            if (node == null) {
                invalid.add(entry.name());
                violations.add("missing key '" + entry.name() + "'");
                continue;
            }
            Optional<String> coerced = coerce(entry, node);
            if (coerced.isPresent()) {
                values.put(entry.name(), coerced.get());
            } else {
                invalid.add(entry.name());
                violations.add(describe(entry, node));
            }
        }

        List<String> unexpected = new ArrayList<>();
        Iterator<String> names = response.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!batch.contains(name)) {
                unexpected.add(name);
            }
        }
        if (!unexpected.isEmpty()) {
            log.warn("extraction.response.unexpected-keys batch={} keys={}", batch.id(), unexpected);
        }
        return new ValidationResult(values, invalid, violations, unexpected);
    }

    /**
     * Every field missing; used when the answer could not be parsed at all.
     */
    public ValidationResult unparsable(Batch batch) {
        Set<String> invalid = new LinkedHashSet<>(batch.fieldNames());
        return new ValidationResult(Map.of(), invalid,
                List.of("response was not a single JSON object"), List.of());
    }

    static Optional<String> coerce(FieldSchemaEntry entry, JsonNode node) {
        switch (entry.type()) {
            case BOOLEAN:
                return coerceBoolean(node);
            case ENUMERATED:
                if (node.isNull()) {
                    return Optional.of("");
                }
                if (!node.isValueNode()) {
                    return Optional.empty();
                }
                String choice = node.asText().strip();
                if (choice.isEmpty()) {
                    return Optional.of("");
                }
                return entry.canonicalOption(choice);
            default:
                if (node.isNull()) {
                    return Optional.of("");
                }
                if (!node.isValueNode()) {
                    return Optional.empty();
                }
                return Optional.of(node.asText().strip());
        }
    }

    private static Optional<String> coerceBoolean(JsonNode node) {
        if (node.isBoolean()) {
            return Optional.of(node.booleanValue() ? FieldSchemaEntry.YES : FieldSchemaEntry.NO);
        }
        if (node.isNull()) {
            return Optional.of(FieldSchemaEntry.NO);
        }
        if (!node.isValueNode()) {
            return Optional.empty();
        }
        String word = node.asText().strip().toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(word)) {
            return Optional.of(FieldSchemaEntry.YES);
        }
        if (FALSE_WORDS.contains(word)) {
            return Optional.of(FieldSchemaEntry.NO);
        }
        return Optional.empty();
    }

    private static String describe(FieldSchemaEntry entry, JsonNode node) {
        return switch (entry.type()) {
            case BOOLEAN -> "'" + entry.name() + "' must be YES or NO, got " + node;
            case ENUMERATED -> "'" + entry.name() + "' must be one of " + entry.options() + " or empty, got " + node;
            default -> "'" + entry.name() + "' must be a plain string, got " + node.getNodeType();
        };
    }
}
