package com.quoteflow.evidence;

import java.math.BigDecimal;
import java.util.Set;
import java.util.regex.Matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.quoteflow.runtime.AppConfig;
import com.quoteflow.schema.FieldSchemaEntry;
import com.quoteflow.schema.FieldType;

/**
 * Decides whether an extracted value is supported by the source document.
 *
 * <p>Text values match as a whole phrase (case and whitespace insensitive) or by fuzzy token coverage:
 * the share of value words (3+ letters) present in the source, each found exactly or within
 * {@code tokenSimilarity} edit-distance similarity, must reach {@code fuzzyThreshold}. Values
 * containing numbers skip the phrase match: every number must appear in the source as a number
 * and any unit under one of its aliases.
 * {@code YES} needs an indicator, synonym or the humanized field name; a choice needs the option
 * or a synonym. Empty values and {@code NO} are always supported.
 */
public class EvidenceVerifier {
    private static final Logger log = LoggerFactory.getLogger(EvidenceVerifier.class);
    private static final int MIN_TOKEN_LENGTH = 3;

    private final double fuzzyThreshold;
    private final double tokenSimilarity;

    public EvidenceVerifier(double fuzzyThreshold, double tokenSimilarity) {
        if (fuzzyThreshold <= 0 || fuzzyThreshold > 1 || tokenSimilarity <= 0 || tokenSimilarity > 1) {
            throw new IllegalArgumentException("thresholds must be in (0, 1]");
        }
        this.fuzzyThreshold = fuzzyThreshold;
        this.tokenSimilarity = tokenSimilarity;
    }

    public static EvidenceVerifier from(AppConfig.EvidenceConfig config) {
        return new EvidenceVerifier(config.getFuzzyThreshold(), config.getTokenSimilarity());
    }

    public boolean isSupported(FieldSchemaEntry entry, String value, EvidenceCorpus corpus) {
        if (value == null || value.isBlank()) {
            return true;
        }
        boolean supported = switch (entry.type()) {
            case BOOLEAN -> !FieldSchemaEntry.YES.equals(value) || checkboxSupported(entry, corpus);
            case ENUMERATED -> choiceSupported(entry, value, corpus);
            default -> textSupported(value, corpus);
        };
        if (!supported) {
            log.debug("evidence.missing field={} type={} value={}", entry.name(), entry.type(), value);
        }
        return supported;
    }

    private static boolean checkboxSupported(FieldSchemaEntry entry, EvidenceCorpus corpus) {
        for (String indicator : entry.positiveIndicators()) {
            if (corpus.containsPhrase(indicator)) {
                return true;
            }
        }
        for (String synonym : entry.synonyms()) {
            if (corpus.containsPhrase(synonym)) {
                return true;
            }
        }
        return corpus.containsPhrase(entry.humanizedName());
    }

    private boolean choiceSupported(FieldSchemaEntry entry, String value, EvidenceCorpus corpus) {
        if (corpus.containsPhrase(value)) {
            return true;
        }
        for (String synonym : entry.synonyms()) {
            if (corpus.containsPhrase(synonym)) {
                return true;
            }
        }
        return false;
    }

    boolean textSupported(String value, EvidenceCorpus corpus) {
        String normalized = EvidenceCorpus.normalize(value);
        if (EvidenceCorpus.NUMBER.matcher(normalized).find()) {
            return numericSupported(normalized, corpus);
        }
        if (corpus.containsPhrase(normalized)) {
            return true;
        }
        return tokenCoverage(normalized, corpus) >= fuzzyThreshold;
    }

    private boolean numericSupported(String normalized, EvidenceCorpus corpus) {
        Matcher matcher = EvidenceCorpus.NUMBER.matcher(normalized);
        while (matcher.find()) {
            BigDecimal number = EvidenceCorpus.canonicalNumber(matcher.group());
            if (!corpus.containsNumber(number)) {
                return false;
            }
        }

        String remainder = normalized;
        for (UnitAliases unit : UnitAliases.values()) {
            if (unit.mentionedIn(remainder)) {
                if (!unit.mentionedIn(corpus.text())) {
                    return false;
                }
                remainder = unit.strip(remainder);
            }
        }
        remainder = EvidenceCorpus.NUMBER.matcher(remainder).replaceAll(" ");
        Set<String> leftover = EvidenceCorpus.words(remainder);
        leftover.removeIf(word -> word.length() < MIN_TOKEN_LENGTH);
        return leftover.isEmpty() || tokenCoverage(String.join(" ", leftover), corpus) >= fuzzyThreshold;
    }

    /**
     * Fraction of value words (3+ letters) found in the source, exactly or approximately.
     */
    double tokenCoverage(String normalized, EvidenceCorpus corpus) {
        Set<String> words = EvidenceCorpus.words(normalized);
        words.removeIf(word -> word.length() < MIN_TOKEN_LENGTH);
        if (words.isEmpty()) {
            return 0.0;
        }
        int found = 0;
        for (String word : words) {
            if (corpus.tokens().contains(word) || approximatelyPresent(word, corpus.tokens())) {
                found++;
            }
        }
        return (double) found / words.size();
    }

    private boolean approximatelyPresent(String word, Set<String> tokens) {
        int maxDistance = (int) Math.floor(word.length() * (1.0 - tokenSimilarity) / tokenSimilarity);
        for (String token : tokens) {
            if (Math.abs(token.length() - word.length()) > maxDistance) {
                continue;
            }
            if (similarity(word, token) >= tokenSimilarity) {
                return true;
            }
        }
        return false;
    }

    static double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / longest;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
