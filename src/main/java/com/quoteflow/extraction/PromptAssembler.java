package com.quoteflow.extraction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.quoteflow.retrieval.RetrievedExample;
import com.quoteflow.schema.Batch;
import com.quoteflow.schema.FieldSchemaEntry;
import com.quoteflow.schema.FieldType;
import com.quoteflow.source.LineItem;
import com.quoteflow.source.SourceDocument;

/**
 * Builds the text sent to the model for one batch. Output is deterministic for the same batch,
 * source and examples.
 */
public class PromptAssembler {
    static final int EXAMPLE_INPUT_CHARS = 500;

    private final SourceWindowSelector windowSelector;

    public PromptAssembler(SourceWindowSelector windowSelector) {
        this.windowSelector = windowSelector;
    }

    public String assemble(Batch batch, SourceDocument source, Map<String, List<RetrievedExample>> examples) {
        StringBuilder prompt = new StringBuilder(batch.estimatedPromptChars() + 2048);
        prompt.append("You extract field values from packaging machinery sales quotes.\n")
                .append("Fill in the fields listed below for ").append(batch.id()).append(" using only the source text.\n\n")
                .append("RULES:\n")
                .append("- Checkbox fields take YES or NO. Answer YES only when the source contains direct evidence,")
                .append(" such as one of the field's indicators. Otherwise answer NO.\n")
                .append("- Choice fields take exactly one of the listed options, or an empty string.\n")
                .append("- Text fields take the value as written in the source, or an empty string when it is absent.\n")
                .append("- Do not guess.\n\n");

        prompt.append("SOURCE TEXT:\n")
                .append(windowSelector.select(source.fullText(), batch))
                .append("\n\n");

        if (!source.lineItems().isEmpty()) {
            prompt.append("LINE ITEMS:\n");
            for (LineItem item : source.lineItems()) {
                prompt.append("- ").append(item.description());
                if (item.quantity() != null && !item.quantity().isBlank()) {
                    prompt.append(" | qty ").append(item.quantity());
                }
                if (item.price() != null && !item.price().isBlank()) {
                    prompt.append(" | price ").append(item.price());
                }
                prompt.append('\n');
            }
            prompt.append('\n');
        }

        prompt.append("FIELDS:\n");
        for (Map.Entry<String, List<FieldSchemaEntry>> section : bySection(batch).entrySet()) {
            prompt.append("## ").append(section.getKey().isEmpty() ? "General" : section.getKey()).append('\n');
            for (FieldSchemaEntry entry : section.getValue()) {
                appendField(prompt, entry);
                appendExamples(prompt, examples.getOrDefault(entry.name(), List.of()));
            }
        }

        prompt.append("\nRESPONSE FORMAT:\n")
                .append("Return a single JSON object and nothing else. It must contain every field name listed above")
                .append(" as a key, with a string value.\n");
        return prompt.toString();
    }

    /**
     * The original prompt followed by the problems found in the previous answer.
     */
    public String repair(String originalPrompt, List<String> violations) {
        StringBuilder prompt = new StringBuilder(originalPrompt);
        prompt.append("\nYOUR PREVIOUS ANSWER WAS REJECTED:\n");
        for (String violation : violations) {
            prompt.append("- ").append(violation).append('\n');
        }
        prompt.append("Answer again with a corrected JSON object containing every field.\n");
        return prompt.toString();
    }

    private static void appendField(StringBuilder prompt, FieldSchemaEntry entry) {
        prompt.append("- ").append(entry.name()).append(" (").append(typeLabel(entry.type())).append(")");
        if (!entry.description().isBlank()) {
            prompt.append(": ").append(entry.description());
        }
        prompt.append('\n');
        if (entry.type() == FieldType.ENUMERATED) {
            prompt.append("  Options: ").append(String.join(" | ", entry.options())).append('\n');
        }
        if (!entry.positiveIndicators().isEmpty()) {
            prompt.append("  Indicators: ").append(String.join(", ", entry.positiveIndicators())).append('\n');
        }
    }

    private static void appendExamples(StringBuilder prompt, List<RetrievedExample> examples) {
        for (RetrievedExample retrieved : examples) {
            String input = retrieved.example().inputContext();
            if (input.length() > EXAMPLE_INPUT_CHARS) {
                input = input.substring(0, EXAMPLE_INPUT_CHARS) + "...";
            }
            prompt.append("  Example\n")
                    .append("    Input: ").append(input.replace('\n', ' ')).append('\n')
                    .append("    Expected Output: ").append(retrieved.example().expectedOutput()).append('\n');
        }
    }

    private static Map<String, List<FieldSchemaEntry>> bySection(Batch batch) {
        Map<String, List<FieldSchemaEntry>> sections = new LinkedHashMap<>();
        for (FieldSchemaEntry entry : batch.fields()) {
            sections.computeIfAbsent(entry.sectionKey(), unused -> new ArrayList<>()).add(entry);
        }
        return sections;
    }

    private static String typeLabel(FieldType type) {
        return switch (type) {
            case BOOLEAN -> "checkbox YES/NO";
            case ENUMERATED -> "choice";
            default -> "text";
        };
    }
}
