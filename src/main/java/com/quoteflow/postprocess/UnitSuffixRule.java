package com.quoteflow.postprocess;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Appends the configured unit to values that are bare numbers, e.g. {@code 480} becomes
 * {@code 480V} and {@code 80} becomes {@code 80 PSI}. Values already carrying letters are left
 * alone.
 */
public class UnitSuffixRule implements PostProcessingRule {
    private static final Pattern BARE_NUMBER = Pattern.compile("[\\d][\\d\\s.,/-]*");

    private final Map<String, String> suffixes;

    public UnitSuffixRule(Map<String, String> suffixes) {
        this.suffixes = Collections.unmodifiableMap(new LinkedHashMap<>(suffixes));
    }

    @Override
    public String name() {
        return "unit-suffix";
    }

    @Override
    public Map<String, String> apply(Map<String, String> fields) {
        Map<String, String> out = new LinkedHashMap<>(fields);
        for (Map.Entry<String, String> suffix : suffixes.entrySet()) {
            String value = out.get(suffix.getKey());
            if (value != null && BARE_NUMBER.matcher(value.strip()).matches()) {
                out.put(suffix.getKey(), value.strip() + suffix.getValue());
            }
        }
        return out;
    }
}
