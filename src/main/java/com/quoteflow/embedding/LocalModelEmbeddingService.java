package com.quoteflow.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline hashed-feature embedding tuned for machinery quotes.
 *
 * <p>Features: whole words, character trigrams, adjacent word pairs (so {@code barcode scanner}
 * differs from a bare {@code scanner}), equipment families keyed by stem ({@code filler} and
 * {@code filling} share {@code fill}) and the unit attached to a quantity ({@code 480V} and
 * {@code 480 volts} share {@code unit:volt}). The quantities themselves are not hashed.
 */
public class LocalModelEmbeddingService implements EmbeddingService {
    private static final String VERSION = "local-quote-v2";
    private static final Pattern TOKEN = Pattern.compile("\\d+(?:[.,]\\d+)*|[a-z][a-z0-9-]*");
    private static final Pattern NUMBER = Pattern.compile("\\d+(?:[.,]\\d+)*");
    private static final List<String> EQUIPMENT_STEMS = List.of(
            "fill", "cap", "label", "monoblock", "conveyor", "unscrambl", "rins", "seal",
            "plc", "hmi", "servo", "beacon", "barcode", "vision", "torque", "pump");
    private static final Map<String, String> UNITS = Map.ofEntries(
            Map.entry("v", "volt"), Map.entry("vac", "volt"), Map.entry("volt", "volt"), Map.entry("volts", "volt"),
            Map.entry("hz", "hertz"), Map.entry("hertz", "hertz"),
            Map.entry("psi", "psi"), Map.entry("bar", "psi"),
            Map.entry("cfm", "cfm"),
            Map.entry("a", "amp"), Map.entry("amp", "amp"), Map.entry("amps", "amp"),
            Map.entry("upm", "rate"), Map.entry("bpm", "rate"), Map.entry("cpm", "rate"),
            Map.entry("ml", "volume"), Map.entry("oz", "volume"), Map.entry("mm", "length"));

    private final int dimension;

    public LocalModelEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        List<String> tokens = tokens(text.toLowerCase(Locale.ROOT));
        String previousWord = null;
        boolean afterNumber = false;
        for (String token : tokens) {
            if (NUMBER.matcher(token).matches()) {
                afterNumber = true;
                continue;
            }
            String unit = UNITS.get(token);
            if (unit != null && afterNumber) {
                addHashed(vector, "unit:" + unit, 1.2f);
                afterNumber = false;
                continue;
            }
            afterNumber = false;

            addHashed(vector, "tok:" + token, 1.0f);
            for (int i = 0; i + 3 <= token.length(); i++) {
                addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
            }
            String stem = equipmentStem(token);
            if (stem != null) {
                addHashed(vector, "domain:" + stem, 1.6f);
            }
            if (previousWord != null) {
                addHashed(vector, "bi:" + previousWord + "_" + token, 0.6f);
            }
            previousWord = token;
        }

        Vectors.normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return VERSION;
    }

    /**
     * Splits {@code 480v} into {@code 480} and {@code v} so attached and spaced units read the same.
     */
    private static List<String> tokens(String normalized) {
        List<String> out = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(normalized);
        while (matcher.find()) {
            out.add(matcher.group());
        }
        return out;
    }

    private void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }

    private static String equipmentStem(String token) {
        for (String stem : EQUIPMENT_STEMS) {
            if (token.startsWith(stem)) {
                return stem;
            }
        }
        return null;
    }
}
