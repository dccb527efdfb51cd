package com.quoteflow.postprocess;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.quoteflow.schema.FieldSchemaEntry;

/**
 * At most one {@code YES} per group. Group members are listed in priority order; the first
 * selected member wins.
 */
public class ExclusiveGroupRule implements PostProcessingRule {
    private static final Logger log = LoggerFactory.getLogger(ExclusiveGroupRule.class);

    private final Map<String, List<String>> groups;

    public ExclusiveGroupRule(Map<String, List<String>> groups) {
        this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    }

    @Override
    public String name() {
        return "exclusive-groups";
    }

    @Override
    public Map<String, String> apply(Map<String, String> fields) {
        Map<String, String> out = new LinkedHashMap<>(fields);
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            String winner = null;
            for (String member : group.getValue()) {
                if (!FieldSchemaEntry.YES.equals(out.get(member))) {
                    continue;
                }
                if (winner == null) {
                    winner = member;
                } else {
                    out.put(member, FieldSchemaEntry.NO);
                    log.debug("postprocess.exclusive group={} kept={} cleared={}", group.getKey(), winner, member);
                }
            }
        }
        return out;
    }

    /**
     * True when some member of the group containing {@code field}, other than the field itself,
     * is already {@code YES}.
     */
    boolean groupHasOtherSelection(String field, Map<String, String> fields) {
        for (List<String> members : groups.values()) {
            if (!members.contains(field)) {
                continue;
            }
            for (String member : members) {
                if (!member.equals(field) && FieldSchemaEntry.YES.equals(fields.get(member))) {
                    return true;
                }
            }
        }
        return false;
    }
}
