package com.quoteflow.examples;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.quoteflow.runtime.PersistenceException;

/**
 * Examples as one pretty-printed JSON array, replaced atomically on save.
 *
 * <p>Records that no longer deserialize are skipped one by one; the original file is copied to
 * {@code <name>.corrupt} first so the next save cannot lose them. A file that is not a JSON array
 * at all is moved aside and reported as a {@link PersistenceException}.
 */
public class JsonFileExampleRepository implements ExampleRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonFileExampleRepository.class);

    private final Path path;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public JsonFileExampleRepository(Path path) {
        this.path = path;
    }

    @Override
    public List<Example> loadAll() {
        JsonNode root;
        try {
            if (!Files.exists(path) || Files.size(path) == 0L) {
                return new ArrayList<>();
            }
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            preserveUnreadable(true);
            throw new PersistenceException("Unable to read examples from " + path, e);
        }
        if (root == null || !root.isArray()) {
            preserveUnreadable(true);
            throw new PersistenceException("Examples file is not a JSON array: " + path);
        }

        List<Example> examples = new ArrayList<>(root.size());
        int skipped = 0;
        for (JsonNode node : root) {
            try {
                examples.add(objectMapper.treeToValue(node, Example.class));
            } catch (JsonProcessingException e) {
                skipped++;
                log.warn("examples.record.skipped path={} id={} reason={}",
                        path, node.path("id").asText(""), e.getOriginalMessage());
            }
        }
        if (skipped > 0) {
            preserveUnreadable(false);
        }
        return examples;
    }

    @Override
    public synchronized void saveAll(Collection<Example> examples) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), examples);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new PersistenceException("Unable to write examples to " + path, e);
        }
    }

    Path corruptCopy() {
        return path.resolveSibling(path.getFileName() + ".corrupt");
    }

    private void preserveUnreadable(boolean move) {
        try {
            if (move) {
                Files.move(path, corruptCopy(), StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.copy(path, corruptCopy(), StandardCopyOption.REPLACE_EXISTING);
            }
            log.warn("examples.preserved path={} copy={} moved={}", path, corruptCopy(), move);
        } catch (IOException e) {
            throw new PersistenceException("Unable to preserve unreadable examples file " + path, e);
        }
    }
}
