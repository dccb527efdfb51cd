package com.quoteflow.schema;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits an ordered schema into batches bounded by field count and estimated prompt size.
 *
 * <p>Consecutive fields sharing a section path form a locality group. A group moves to a fresh
 * batch rather than being split; only a group larger than a cap on its own is force-split, in
 * field order.
 */
public class SchemaPartitioner {
    private static final Logger log = LoggerFactory.getLogger(SchemaPartitioner.class);
    static final int FIELD_OVERHEAD_CHARS = 48;
    static final int EXAMPLE_ALLOWANCE_CHARS = 160;

    private final int maxFieldsPerBatch;
    private final int maxPromptChars;

    public SchemaPartitioner(int maxFieldsPerBatch, int maxPromptChars) {
        if (maxFieldsPerBatch <= 0) {
            throw new IllegalArgumentException("maxFieldsPerBatch must be > 0");
        }
        if (maxPromptChars <= 0) {
            throw new IllegalArgumentException("maxPromptChars must be > 0");
        }
        this.maxFieldsPerBatch = maxFieldsPerBatch;
        this.maxPromptChars = maxPromptChars;
    }

    public List<Batch> partition(FieldSchema schema) {
        List<Batch> batches = new ArrayList<>();
        List<FieldSchemaEntry> current = new ArrayList<>();
        int currentChars = 0;

        for (List<FieldSchemaEntry> group : localityGroups(schema.entries())) {
            int groupChars = group.stream().mapToInt(SchemaPartitioner::estimateCost).sum();
            boolean fits = current.size() + group.size() <= maxFieldsPerBatch
                    && currentChars + groupChars <= maxPromptChars;
            if (fits) {
                current.addAll(group);
                currentChars += groupChars;
                continue;
            }

            if (!current.isEmpty()) {
                batches.add(toBatch(batches.size(), current, currentChars));
                current = new ArrayList<>();
                currentChars = 0;
            }

            if (group.size() <= maxFieldsPerBatch && groupChars <= maxPromptChars) {
                current.addAll(group);
                currentChars = groupChars;
                continue;
            }

            log.debug("partition.force-split section={} fields={} chars={}",
                    group.get(0).sectionKey(), group.size(), groupChars);
            for (FieldSchemaEntry entry : group) {
                int cost = estimateCost(entry);
                boolean overflow = current.size() + 1 > maxFieldsPerBatch
                        || (!current.isEmpty() && currentChars + cost > maxPromptChars);
                if (overflow) {
                    batches.add(toBatch(batches.size(), current, currentChars));
                    current = new ArrayList<>();
                    currentChars = 0;
                }
                current.add(entry);
                currentChars += cost;
            }
        }

        if (!current.isEmpty()) {
            batches.add(toBatch(batches.size(), current, currentChars));
        }
        log.info("partition.done variant={} fields={} batches={} maxFields={} maxChars={}",
                schema.variant(), schema.size(), batches.size(), maxFieldsPerBatch, maxPromptChars);
        return batches;
    }

    static int estimateCost(FieldSchemaEntry entry) {
        int cost = FIELD_OVERHEAD_CHARS + EXAMPLE_ALLOWANCE_CHARS
                + entry.name().length()
                + entry.description().length();
        for (String option : entry.options()) {
            cost += option.length() + 2;
        }
        for (String indicator : entry.positiveIndicators()) {
            cost += indicator.length() + 2;
        }
        for (String synonym : entry.synonyms()) {
            cost += synonym.length() + 2;
        }
        return cost;
    }

    private static List<List<FieldSchemaEntry>> localityGroups(List<FieldSchemaEntry> entries) {
        List<List<FieldSchemaEntry>> groups = new ArrayList<>();
        List<FieldSchemaEntry> group = new ArrayList<>();
        for (FieldSchemaEntry entry : entries) {
            if (!group.isEmpty() && !group.get(0).sectionPath().equals(entry.sectionPath())) {
                groups.add(group);
                group = new ArrayList<>();
            }
            group.add(entry);
        }
        if (!group.isEmpty()) {
            groups.add(group);
        }
        return groups;
    }

    private static Batch toBatch(int index, List<FieldSchemaEntry> fields, int chars) {
        return new Batch("batch-%03d".formatted(index + 1), index, fields, chars);
    }
}
