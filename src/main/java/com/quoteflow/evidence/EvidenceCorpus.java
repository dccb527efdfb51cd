package com.quoteflow.evidence;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.quoteflow.source.LineItem;
import com.quoteflow.source.SourceDocument;

/**
 * Normalized view of one source document: lower-cased, whitespace-collapsed text including line
 * item descriptions, plus its word tokens and numbers. Built once per extraction and shared by
 * all batches.
 */
public final class EvidenceCorpus {
    static final Pattern NUMBER = Pattern.compile("\\d[\\d,]*(?:\\.\\d+)?");
    private static final Pattern WORD = Pattern.compile("[a-z][a-z0-9]*");

    private final String text;
    private final Set<String> tokens;
    private final Set<BigDecimal> numbers;

    private EvidenceCorpus(String text) {
        this.text = text;
        this.tokens = Set.copyOf(words(text));
        this.numbers = Set.copyOf(numbers(text));
    }

    public static EvidenceCorpus of(SourceDocument document) {
        StringBuilder all = new StringBuilder(document.fullText());
        for (LineItem item : document.lineItems()) {
            all.append('\n').append(item.description());
        }
        return new EvidenceCorpus(normalize(all.toString()));
    }

    public static EvidenceCorpus of(String text, List<LineItem> lineItems) {
        return of(new SourceDocument(text, lineItems));
    }

    /**
     * Whole-word match of the normalized phrase, allowing a plural {@code s}. {@code cap} does not
     * match {@code capacity} and {@code 500 psi} does not match {@code 1500 psi}.
     */
    public boolean containsPhrase(String phrase) {
        String normalized = normalize(phrase);
        if (normalized.isEmpty()) {
            return false;
        }
        return Pattern.compile("(?<![a-z0-9.,])" + Pattern.quote(normalized) + "s?(?![a-z0-9])")
                .matcher(text)
                .find();
    }

    public boolean containsNumber(BigDecimal number) {
        return numbers.contains(number);
    }

    public String text() {
        return text;
    }

    Set<String> tokens() {
        return tokens;
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").strip();
    }

    static Set<String> words(String normalized) {
        Set<String> out = new HashSet<>();
        Matcher matcher = WORD.matcher(normalized);
        while (matcher.find()) {
            out.add(matcher.group());
        }
        return out;
    }

    /**
     * Numbers with grouping commas removed and trailing zeros stripped, so {@code 1,500} and
     * {@code 1500.0} compare equal.
     */
    static Set<BigDecimal> numbers(String text) {
        Set<BigDecimal> out = new HashSet<>();
        Matcher matcher = NUMBER.matcher(text);
        while (matcher.find()) {
            out.add(canonicalNumber(matcher.group()));
        }
        return out;
    }

    static BigDecimal canonicalNumber(String raw) {
        BigDecimal value = new BigDecimal(raw.replace(",", ""));
        return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }
}
