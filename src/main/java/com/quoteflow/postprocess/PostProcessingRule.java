package com.quoteflow.postprocess;

import java.util.Map;

/**
 * Pure transformation of a complete field map. Implementations never modify their input.
 */
public interface PostProcessingRule {
    String name();

    Map<String, String> apply(Map<String, String> fields);
}
