package com.quoteflow.extraction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.quoteflow.postprocess.FieldSuggestion;

/**
 * Ordered extraction result: one {@link FieldResult} per schema field, in schema order.
 */
public final class FieldMap {
    private final Map<String, FieldResult> results;
    private final List<FieldSuggestion> suggestions;
    private final boolean cancelled;

    public FieldMap(Collection<FieldResult> results, List<FieldSuggestion> suggestions, boolean cancelled) {
        Map<String, FieldResult> ordered = new LinkedHashMap<>();
        for (FieldResult result : results) {
            ordered.put(result.fieldName(), result);
        }
        this.results = Collections.unmodifiableMap(ordered);
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        this.cancelled = cancelled;
    }

    public Optional<FieldResult> get(String fieldName) {
        return Optional.ofNullable(results.get(fieldName));
    }

    public String value(String fieldName) {
        FieldResult result = results.get(fieldName);
        return result == null ? "" : result.value().text();
    }

    public Collection<FieldResult> results() {
        return results.values();
    }

    public Map<String, String> values() {
        Map<String, String> out = new LinkedHashMap<>();
        results.forEach((name, result) -> out.put(name, result.value().text()));
        return out;
    }

    public List<FieldSuggestion> suggestions() {
        return suggestions;
    }

    public boolean cancelled() {
        return cancelled;
    }

    public int size() {
        return results.size();
    }

    /**
     * Fields that must be looked at by a person before a document is finalized, grouped by
     * status ({@code UNRESOLVED} and {@code ZERO_EVIDENCE} kept apart).
     */
    public Map<FieldStatus, List<String>> needsReview() {
        Map<FieldStatus, List<String>> review = new EnumMap<>(FieldStatus.class);
        for (FieldResult result : results.values()) {
            if (result.status().needsReview()) {
                review.computeIfAbsent(result.status(), unused -> new ArrayList<>()).add(result.fieldName());
            }
        }
        return review;
    }

    public List<String> withStatus(FieldStatus status) {
        return results.values().stream()
                .filter(result -> result.status() == status)
                .map(FieldResult::fieldName)
                .toList();
    }
}
