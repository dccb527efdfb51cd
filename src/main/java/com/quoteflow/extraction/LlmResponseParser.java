package com.quoteflow.extraction;

import java.io.IOException;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Pulls the JSON object out of raw model text. Tolerates Markdown fences, leading chatter and a
 * {@code {"fields": {...}}} envelope.
 */
public class LlmResponseParser {
    private final ObjectMapper mapper = new ObjectMapper();

    public Optional<ObjectNode> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = stripFences(raw.strip());
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(text.substring(start, end + 1));
            if (!(node instanceof ObjectNode object)) {
                return Optional.empty();
            }
            JsonNode envelope = object.get("fields");
            if (object.size() == 1 && envelope instanceof ObjectNode inner) {
                return Optional.of(inner);
            }
            return Optional.of(object);
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    private static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        String body = firstNewline < 0 ? text.substring(3) : text.substring(firstNewline + 1);
        int closing = body.lastIndexOf("```");
        return closing < 0 ? body : body.substring(0, closing);
    }
}
