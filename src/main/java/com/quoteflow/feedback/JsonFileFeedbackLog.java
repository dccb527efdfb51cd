package com.quoteflow.feedback;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.quoteflow.runtime.PersistenceException;

public class JsonFileFeedbackLog implements FeedbackLog {
    private final Path path;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public JsonFileFeedbackLog(Path path) {
        this.path = path;
    }

    @Override
    public synchronized void append(FeedbackRecord record) {
        List<FeedbackRecord> records = loadAll();
        records.add(record);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), records);
        } catch (IOException e) {
            throw new PersistenceException("Unable to write feedback log " + path, e);
        }
    }

    @Override
    public synchronized List<FeedbackRecord> loadAll() {
        try {
            if (!Files.exists(path) || Files.size(path) == 0L) {
                return new ArrayList<>();
            }
            return objectMapper.readValue(path.toFile(), new TypeReference<List<FeedbackRecord>>() {
            });
        } catch (IOException e) {
            throw new PersistenceException("Unable to read feedback log " + path, e);
        }
    }
}
