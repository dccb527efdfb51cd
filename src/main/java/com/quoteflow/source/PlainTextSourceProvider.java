package com.quoteflow.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Loads {@code <handle>} as UTF-8 text and, when present, {@code <handle>.items.json} as the
 * line items.
 */
public class PlainTextSourceProvider implements SourceTextProvider {
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public SourceDocument load(String documentHandle) throws IOException {
        Path textPath = Path.of(documentHandle);
        if (!Files.isRegularFile(textPath)) {
            throw new IllegalArgumentException("Source document not found: " + textPath.toAbsolutePath().normalize());
        }
        String text = Files.readString(textPath);
        Path itemsPath = textPath.resolveSibling(textPath.getFileName() + ".items.json");
        List<LineItem> items = List.of();
        if (Files.exists(itemsPath)) {
            items = mapper.readValue(itemsPath.toFile(), new TypeReference<List<LineItem>>() {
            });
        }
        return new SourceDocument(text, items);
    }
}
