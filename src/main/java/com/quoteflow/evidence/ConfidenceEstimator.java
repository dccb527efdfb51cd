package com.quoteflow.evidence;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.quoteflow.schema.FieldSchemaEntry;
import com.quoteflow.schema.FieldType;

/**
 * Heuristic confidence for one extracted value, from how much of it the source backs up.
 */
public class ConfidenceEstimator {
    public static final double HIGH = 0.8;
    public static final double MEDIUM = 0.5;

    static final double EMPTY = 0.3;
    static final double CHECKBOX_NO = 0.75;
    private static final Set<String> PLACEHOLDERS = Set.of(
            "n/a", "na", "not applicable", "not specified", "not selected", "none selected",
            "to be determined", "tbd", "pending", "not available", "unknown", "not provided");

    public double estimate(FieldSchemaEntry entry, String value, EvidenceCorpus corpus) {
        if (value == null || value.isBlank()) {
            return EMPTY;
        }
        if (entry.type() == FieldType.BOOLEAN) {
            return FieldSchemaEntry.YES.equals(value) ? checkbox(entry, corpus) : CHECKBOX_NO;
        }
        return text(value, corpus);
    }

    private static double checkbox(FieldSchemaEntry entry, EvidenceCorpus corpus) {
        List<String> terms = new ArrayList<>(entry.positiveIndicators());
        terms.addAll(entry.synonyms());
        for (String part : entry.humanizedName().split(" ")) {
            if (part.length() > 2) {
                terms.add(part);
            }
        }
        long found = terms.stream().filter(corpus::containsPhrase).count();
        if (found >= 3) {
            return 0.95;
        }
        if (found == 2) {
            return 0.85;
        }
        if (found == 1) {
            return 0.7;
        }
        return 0.4;
    }

    private static double text(String value, EvidenceCorpus corpus) {
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        if (PLACEHOLDERS.contains(normalized)) {
            return 0.2;
        }
        if (corpus.containsPhrase(normalized)) {
            return 0.9;
        }
        for (String word : normalized.split("\\s+")) {
            if (word.length() > 3 && corpus.containsPhrase(word)) {
                return 0.7;
            }
        }
        return 0.5;
    }

    public static String level(double confidence) {
        if (confidence >= HIGH) {
            return "high";
        }
        return confidence >= MEDIUM ? "medium" : "low";
    }
}
