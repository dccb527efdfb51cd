package com.quoteflow.postprocess;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Cross-field plausibility checks on supply voltage, frequency and pneumatics. Produces
 * suggestions only; the field map itself is never changed.
 */
public class FieldDependencyValidator {
    public static final double CONFIDENCE_CAP = 0.4;

    private static final List<String> SIXTY_HZ_VOLTAGES = List.of("480", "460", "440", "120", "110", "115");
    private static final List<String> FIFTY_HZ_VOLTAGES = List.of("400", "380", "415", "230", "220", "240");
    private static final List<String> STRICT_FIFTY_HZ_VOLTAGES = List.of("400", "380", "415");
    private static final List<String> STRICT_SIXTY_HZ_VOLTAGES = List.of("480", "460", "440");

    public List<FieldSuggestion> validate(Map<String, String> fields) {
        List<FieldSuggestion> suggestions = new ArrayList<>();
        String voltage = fields.getOrDefault("voltage", "").toUpperCase(Locale.ROOT);
        String hz = fields.getOrDefault("hz", "");

        if (!voltage.isBlank() && hz.isBlank()) {
            if (containsAny(voltage, SIXTY_HZ_VOLTAGES)) {
                suggestions.add(new FieldSuggestion("hz", hz, "60 Hz",
                        "voltage " + voltage + " normally runs at 60 Hz (North America)", FieldSuggestion.Kind.SUGGESTION, false));
            } else if (containsAny(voltage, FIFTY_HZ_VOLTAGES)) {
                suggestions.add(new FieldSuggestion("hz", hz, "50 Hz",
                        "voltage " + voltage + " normally runs at 50 Hz (Europe)", FieldSuggestion.Kind.SUGGESTION, false));
            }
        }

        if (!voltage.isBlank() && !hz.isBlank()) {
            String frequency = hz.replaceAll("(?i)hz", "").strip();
            if ("60".equals(frequency) && containsAny(voltage, STRICT_FIFTY_HZ_VOLTAGES)) {
                suggestions.add(new FieldSuggestion("hz", hz, "50 Hz",
                        "voltage " + voltage + " normally uses 50 Hz, not 60 Hz", FieldSuggestion.Kind.WARNING, true));
            }
            if ("50".equals(frequency) && containsAny(voltage, STRICT_SIXTY_HZ_VOLTAGES)) {
                suggestions.add(new FieldSuggestion("hz", hz, "60 Hz",
                        "voltage " + voltage + " normally uses 60 Hz, not 50 Hz", FieldSuggestion.Kind.WARNING, true));
            }
        }

        String psi = fields.getOrDefault("psi", "");
        String cfm = fields.getOrDefault("cfm", "");
        if (!psi.isBlank() && cfm.isBlank() && fields.containsKey("cfm")) {
            suggestions.add(new FieldSuggestion("cfm", cfm, null,
                    "air pressure is given but air consumption is missing", FieldSuggestion.Kind.INFO, true));
        }
        return suggestions;
    }

    private static boolean containsAny(String value, List<String> needles) {
        return needles.stream().anyMatch(value::contains);
    }
}
