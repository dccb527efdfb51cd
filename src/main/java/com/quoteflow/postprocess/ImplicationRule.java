package com.quoteflow.postprocess;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.quoteflow.schema.FieldSchemaEntry;

/**
 * A selected trigger checkbox selects its target checkboxes, for example a tri-colour beacon
 * selecting each colour. A target is skipped when its exclusive group already has a selection.
 */
public class ImplicationRule implements PostProcessingRule {
    private final Map<String, List<String>> implications;
    private final ExclusiveGroupRule exclusiveGroups;

    public ImplicationRule(Map<String, List<String>> implications, ExclusiveGroupRule exclusiveGroups) {
        this.implications = Collections.unmodifiableMap(new LinkedHashMap<>(implications));
        this.exclusiveGroups = exclusiveGroups;
    }

    @Override
    public String name() {
        return "implications";
    }

    @Override
    public Map<String, String> apply(Map<String, String> fields) {
        Map<String, String> out = new LinkedHashMap<>(fields);
        for (Map.Entry<String, List<String>> implication : implications.entrySet()) {
            if (!FieldSchemaEntry.YES.equals(out.get(implication.getKey()))) {
                continue;
            }
            for (String target : implication.getValue()) {
                if (out.containsKey(target) && !exclusiveGroups.groupHasOtherSelection(target, out)) {
                    out.put(target, FieldSchemaEntry.YES);
                }
            }
        }
        return out;
    }
}
