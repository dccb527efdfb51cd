package com.quoteflow.source;

import java.util.List;

public record SourceDocument(String fullText, List<LineItem> lineItems) {
    public static final int EXAMPLE_CONTEXT_CHARS = 1000;

    public SourceDocument {
        fullText = fullText == null ? "" : fullText;
        lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    }

    /**
     * Short description of the document used both as the retrieval query and as the input
     * context of examples learned from it: line item descriptions first, then the opening of the
     * text, whitespace collapsed and capped at {@link #EXAMPLE_CONTEXT_CHARS}.
     */
    public String exampleContext() {
        StringBuilder context = new StringBuilder();
        for (LineItem item : lineItems) {
            if (!item.description().isBlank()) {
                context.append(item.description().strip()).append("; ");
            }
        }
        context.append(fullText);
        String collapsed = context.toString().replaceAll("\\s+", " ").strip();
        return collapsed.length() <= EXAMPLE_CONTEXT_CHARS ? collapsed : collapsed.substring(0, EXAMPLE_CONTEXT_CHARS);
    }
}
