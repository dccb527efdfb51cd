package com.quoteflow.source;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlainTextSourceProviderTest {
    @TempDir
    Path tempDir;

    private final PlainTextSourceProvider provider = new PlainTextSourceProvider();

    @Test
    void shouldLoadTextAndLineItemSidecar() throws Exception {
        Path text = tempDir.resolve("quote-17.txt");
        Files.writeString(text, "Rotary capper\n\n480 volts");
        Files.writeString(tempDir.resolve("quote-17.txt.items.json"), """
                [ { "description": "Rotary capper", "quantity": "1", "price": "$45,000", "sku": "RC-24" },
                  { "description": "Change parts" } ]
                """);

        SourceDocument document = provider.load(text.toString());

        assertEquals("Rotary capper\n\n480 volts", document.fullText());
        assertEquals(2, document.lineItems().size());
        assertEquals("$45,000", document.lineItems().get(0).price());
    }

    @Test
    void shouldLoadTextWithoutSidecar() throws Exception {
        Path text = tempDir.resolve("quote.txt");
        Files.writeString(text, "Labeler");

        assertTrue(provider.load(text.toString()).lineItems().isEmpty());
    }

    @Test
    void shouldRejectMissingDocument() {
        assertThrows(IllegalArgumentException.class, () -> provider.load(tempDir.resolve("absent.txt").toString()));
    }

    @Test
    void shouldBuildCompactExampleContext() {
        SourceDocument document = new SourceDocument("Filler   with\n\nSiemens controls " + "x".repeat(2000),
                List.of(LineItem.of("Monoblock filler"), LineItem.of(" ")));

        String context = document.exampleContext();

        assertTrue(context.startsWith("Monoblock filler; Filler with Siemens controls x"));
        assertEquals(SourceDocument.EXAMPLE_CONTEXT_CHARS, context.length());
    }
}
