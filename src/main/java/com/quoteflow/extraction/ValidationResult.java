package com.quoteflow.extraction;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of checking one model answer against a batch.
 *
 * @param values     coerced values for every field that passed
 * @param invalid    fields that are missing or failed coercion
 * @param violations human-readable reasons, fed back in the repair prompt
 * @param unexpected keys the model returned that the batch does not declare
 */
public record ValidationResult(
        Map<String, String> values,
        Set<String> invalid,
        List<String> violations,
        List<String> unexpected) {

    public ValidationResult {
        values = Map.copyOf(values);
        invalid = Set.copyOf(invalid);
        violations = List.copyOf(violations);
        unexpected = List.copyOf(unexpected);
    }

    public boolean valid() {
        return invalid.isEmpty();
    }
}
