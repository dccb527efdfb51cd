package com.quoteflow.extraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.quoteflow.schema.Batch;
import com.quoteflow.schema.FieldSchemaEntry;
import com.quoteflow.schema.FieldType;

/**
 * Chooses the part of a long source document that is sent with a batch.
 *
 * <p>Short documents pass through unchanged. Longer ones are split into paragraphs; each
 * paragraph is scored by how many of the batch's vocabulary terms it contains, and the best
 * paragraphs are kept, in document order, until the budget is used.
 */
public class SourceWindowSelector {
    private final int maxChars;

    public SourceWindowSelector(int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be > 0");
        }
        this.maxChars = maxChars;
    }

    public String select(String text, Batch batch) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxChars) {
            return text;
        }

        String[] paragraphs = text.split("\\n\\s*\\n");
        Set<String> vocabulary = vocabulary(batch);
        List<Scored> scored = new ArrayList<>(paragraphs.length);
        for (int i = 0; i < paragraphs.length; i++) {
            String paragraph = paragraphs[i].strip();
            if (!paragraph.isEmpty()) {
                scored.add(new Scored(i, paragraph, score(paragraph, vocabulary)));
            }
        }

        List<Scored> ranked = new ArrayList<>(scored);
        ranked.sort(Comparator.comparingInt(Scored::score).reversed().thenComparingInt(Scored::index));
        List<Scored> kept = new ArrayList<>();
        int used = 0;
        for (Scored candidate : ranked) {
            int cost = candidate.text().length() + 2;
            if (used + cost > maxChars) {
                continue;
            }
            kept.add(candidate);
            used += cost;
        }
        if (kept.isEmpty()) {
            return text.substring(0, maxChars);
        }

        kept.sort(Comparator.comparingInt(Scored::index));
        StringBuilder out = new StringBuilder(used);
        for (Scored paragraph : kept) {
            if (out.length() > 0) {
                out.append("\n\n");
            }
            out.append(paragraph.text());
        }
        return out.toString();
    }

    static Set<String> vocabulary(Batch batch) {
        Set<String> terms = new HashSet<>();
        for (FieldSchemaEntry entry : batch.fields()) {
            addTerms(terms, entry.humanizedName());
            addTerms(terms, entry.description());
            entry.positiveIndicators().forEach(indicator -> addTerms(terms, indicator));
            entry.synonyms().forEach(synonym -> addTerms(terms, synonym));
            if (entry.type() != FieldType.BOOLEAN) {
                entry.options().forEach(option -> addTerms(terms, option));
            }
        }
        return terms;
    }

    private static void addTerms(Set<String> terms, String text) {
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() >= 3) {
                terms.add(token);
            }
        }
    }

    private static int score(String paragraph, Set<String> vocabulary) {
        Set<String> seen = new HashSet<>();
        for (String token : paragraph.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (vocabulary.contains(token)) {
                seen.add(token);
            }
        }
        return seen.size();
    }

    private record Scored(int index, String text, int score) {
    }
}
