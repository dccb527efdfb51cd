package com.quoteflow.evidence;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Spellings accepted as the same unit when matching numeric values against the source. One-letter
 * aliases only count directly after a number, as in {@code 480v} or {@code 30 a}.
 */
enum UnitAliases {
    PSI("psi", "lb/in2", "lbs/in2", "pounds per square inch"),
    UNITS_PER_MINUTE("units per minute", "units/min", "units/minute", "upm"),
    VOLT("volts", "volt", "vac", "v"),
    HERTZ("hertz", "hz"),
    CFM("cfm", "cubic feet per minute"),
    AMP("amps", "amp", "a");

    private final List<String> aliases;
    private final List<Pattern> patterns;

    UnitAliases(String... aliases) {
        this.aliases = List.of(aliases);
        this.patterns = this.aliases.stream()
                .map(alias -> Pattern.compile((alias.length() == 1 ? "(?<=\\d ?)" : "(?<![a-z])")
                        + Pattern.quote(alias) + "(?![a-z])"))
                .toList();
    }

    boolean mentionedIn(String normalized) {
        return patterns.stream().anyMatch(pattern -> pattern.matcher(normalized).find());
    }

    /**
     * Removes every alias of this unit from the text.
     */
    String strip(String normalized) {
        String out = normalized;
        for (Pattern pattern : patterns) {
            out = pattern.matcher(out).replaceAll(" ");
        }
        return out;
    }

    List<String> aliases() {
        return aliases;
    }
}
