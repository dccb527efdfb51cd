package com.quoteflow.postprocess;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.quoteflow.runtime.AppConfig;
import com.quoteflow.schema.FieldSchema;
import com.quoteflow.schema.FieldSchemaEntry;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PostProcessingEngineTest {
    private final FieldSchema schema = new FieldSchema("default", List.of(
            FieldSchemaEntry.text("voltage", List.of("Utilities"), "Supply voltage"),
            FieldSchemaEntry.text("psi", List.of("Utilities"), "Air pressure"),
            FieldSchemaEntry.checkbox("hmi_7_check", List.of("HMI"), "7 inch HMI", List.of()),
            FieldSchemaEntry.checkbox("hmi_10_check", List.of("HMI"), "10 inch HMI", List.of()),
            FieldSchemaEntry.checkbox("beacon_tri_color_check", List.of("Beacon"), "Tri-colour beacon", List.of()),
            FieldSchemaEntry.checkbox("beacon_red_check", List.of("Beacon"), "Red light", List.of()),
            FieldSchemaEntry.checkbox("beacon_amber_check", List.of("Beacon"), "Amber light", List.of()),
            FieldSchemaEntry.checkbox("beacon_green_check", List.of("Beacon"), "", List.of()),
            FieldSchemaEntry.text("options_listing", List.of("Summary"), "Selected options")));

    private final PostProcessingEngine engine = PostProcessingEngine.forSchema(schema, config());

    @Test
    void shouldApplyEveryRule() {
        Map<String, String> out = engine.apply(input());

        assertEquals("480V", out.get("voltage"));
        assertEquals("80 PSI", out.get("psi"));
        assertEquals("YES", out.get("hmi_7_check"));
        assertEquals("NO", out.get("hmi_10_check"));
        assertEquals("YES", out.get("beacon_red_check"));
        assertEquals("YES", out.get("beacon_amber_check"));
        assertEquals("YES", out.get("beacon_green_check"));
        assertEquals("7 inch HMI, Tri-colour beacon, Red light, Amber light, beacon green", out.get("options_listing"));
    }

    @Test
    void shouldBeIdempotent() {
        Map<String, String> once = engine.apply(input());

        assertEquals(once, engine.apply(once));
    }

    @Test
    void shouldLeaveLockedFieldsUntouched() {
        Map<String, String> out = engine.apply(input(), Set.of("voltage", "beacon_red_check"));

        assertEquals("480", out.get("voltage"));
        assertEquals("NO", out.get("beacon_red_check"));
        assertEquals("YES", out.get("beacon_amber_check"));
        assertEquals("7 inch HMI, Tri-colour beacon, Amber light, beacon green", out.get("options_listing"));
    }

    @Test
    void shouldNotImplyIntoGroupWithAnotherSelection() {
        ExclusiveGroupRule exclusive = new ExclusiveGroupRule(Map.of("plc-type", List.of("plc_siemens_check", "plc_ab_check")));
        ImplicationRule implication = new ImplicationRule(Map.of("filling_system_check", List.of("plc_ab_check")), exclusive);
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("filling_system_check", "YES");
        fields.put("plc_siemens_check", "YES");
        fields.put("plc_ab_check", "NO");

        assertEquals("NO", implication.apply(fields).get("plc_ab_check"));
    }

    @Test
    void shouldSkipSummaryFieldMissingFromSchema() {
        SummaryFieldRule rule = new SummaryFieldRule(schema, "not_a_field");
        Map<String, String> fields = Map.of("hmi_7_check", "YES");

        assertEquals(fields, rule.apply(fields));
    }

    private static Map<String, String> input() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("voltage", "480");
        fields.put("psi", " 80 ");
        fields.put("hmi_7_check", "yes");
        fields.put("hmi_10_check", "YES");
        fields.put("beacon_tri_color_check", "Yes");
        fields.put("beacon_red_check", "NO");
        fields.put("beacon_amber_check", "");
        fields.put("beacon_green_check", "maybe");
        fields.put("options_listing", "stale text from the model");
        return fields;
    }

    private static AppConfig.PostProcessingConfig config() {
        AppConfig.ExclusiveGroup hmi = new AppConfig.ExclusiveGroup();
        hmi.setName("hmi-size");
        hmi.setFields(List.of("hmi_7_check", "hmi_10_check"));
        AppConfig.PostProcessingConfig config = new AppConfig.PostProcessingConfig();
        config.setExclusiveGroups(List.of(hmi));
        config.setImplications(Map.of("beacon_tri_color_check",
                List.of("beacon_red_check", "beacon_amber_check", "beacon_green_check")));
        return config;
    }
}
