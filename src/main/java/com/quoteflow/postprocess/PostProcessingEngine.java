package com.quoteflow.postprocess;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.quoteflow.runtime.AppConfig;
import com.quoteflow.schema.FieldSchema;

/**
 * Runs the rule set over a field map until nothing changes, so running the engine again on its
 * own output is a no-op.
 */
public class PostProcessingEngine {
    private static final Logger log = LoggerFactory.getLogger(PostProcessingEngine.class);
    static final int MAX_PASSES = 8;

    private final List<PostProcessingRule> rules;

    public PostProcessingEngine(List<PostProcessingRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static PostProcessingEngine forSchema(FieldSchema schema, AppConfig.PostProcessingConfig config) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (AppConfig.ExclusiveGroup group : config.getExclusiveGroups()) {
            groups.put(group.getName() == null ? "group-" + groups.size() : group.getName(), List.copyOf(group.getFields()));
        }
        ExclusiveGroupRule exclusive = new ExclusiveGroupRule(groups);
        return new PostProcessingEngine(List.of(
                new CheckboxNormalizationRule(schema),
                exclusive,
                new ImplicationRule(config.getImplications(), exclusive),
                new UnitSuffixRule(config.getUnitSuffixes()),
                new SummaryFieldRule(schema, config.getSummaryField())));
    }

    public Map<String, String> apply(Map<String, String> fields) {
        return apply(fields, Set.of());
    }

    /**
     * Same as {@link #apply(Map)}, but the {@code locked} fields keep their input values; rules
     * still see them when deciding about other fields.
     */
    public Map<String, String> apply(Map<String, String> fields, Set<String> locked) {
        Map<String, String> current = new LinkedHashMap<>(fields);
        for (int pass = 1; pass <= MAX_PASSES; pass++) {
            Map<String, String> next = current;
            for (PostProcessingRule rule : rules) {
                next = restore(rule.apply(next), fields, locked);
            }
            if (next.equals(current)) {
                log.debug("postprocess.done passes={} fields={} locked={}", pass, current.size(), locked.size());
                return current;
            }
            current = new LinkedHashMap<>(next);
        }
        log.warn("postprocess.no-fixed-point passes={} fields={}", MAX_PASSES, current.size());
        return current;
    }

    private static Map<String, String> restore(Map<String, String> processed, Map<String, String> original, Set<String> locked) {
        if (locked.isEmpty()) {
            return processed;
        }
        Map<String, String> out = new LinkedHashMap<>(processed);
        for (String field : locked) {
            if (original.containsKey(field)) {
                out.put(field, original.get(field));
            }
        }
        return out;
    }
}
