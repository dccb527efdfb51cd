package com.quoteflow.schema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads {@code <schemaDir>/<variant>.json}. Schemas are cached per variant since they are
 * immutable for the life of a run.
 */
public class JsonTemplateSchemaProvider implements TemplateSchemaProvider {
    private final Path schemaDir;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ConcurrentHashMap<String, FieldSchema> cache = new ConcurrentHashMap<>();

    public JsonTemplateSchemaProvider(Path schemaDir) {
        this.schemaDir = schemaDir;
    }

    @Override
    public FieldSchema schemaFor(String variant) throws IOException {
        FieldSchema cached = cache.get(variant);
        if (cached != null) {
            return cached;
        }
        Path file = schemaDir.resolve(variant + ".json");
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("Unknown template variant: " + variant + " (expected " + file + ")");
        }
        SchemaDocument document = mapper.readValue(file.toFile(), SchemaDocument.class);
        FieldSchema schema = new FieldSchema(variant, document.fields() == null ? List.of() : document.fields());
        cache.putIfAbsent(variant, schema);
        return schema;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SchemaDocument(String variant, List<FieldSchemaEntry> fields) {
    }
}
