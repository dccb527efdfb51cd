package com.quoteflow.evidence;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.quoteflow.schema.FieldSchemaEntry;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfidenceEstimatorTest {
    private final ConfidenceEstimator estimator = new ConfidenceEstimator();
    private final FieldSchemaEntry siemens = FieldSchemaEntry.checkbox("plc_siemens_check", List.of(), "", List.of("S7-1500"));
    private final FieldSchemaEntry frame = FieldSchemaEntry.text("frame_material", List.of(), "");

    @Test
    void shouldScoreCheckboxesByEvidenceTerms() {
        assertEquals(0.95, estimator.estimate(siemens, "YES", corpus("Siemens S7-1500 PLC")));
        assertEquals(0.85, estimator.estimate(siemens, "YES", corpus("Siemens PLC")));
        assertEquals(0.7, estimator.estimate(siemens, "YES", corpus("Siemens controls")));
        assertEquals(0.4, estimator.estimate(siemens, "YES", corpus("Rockwell controls")));
        assertEquals(ConfidenceEstimator.CHECKBOX_NO, estimator.estimate(siemens, "NO", corpus("Rockwell controls")));
    }

    @Test
    void shouldScoreTextByHowMuchOfItAppears() {
        assertEquals(ConfidenceEstimator.EMPTY, estimator.estimate(frame, "", corpus("anything")));
        assertEquals(0.2, estimator.estimate(frame, "TBD", corpus("frame TBD")));
        assertEquals(0.9, estimator.estimate(frame, "Stainless Steel", corpus("Frame: stainless steel")));
        assertEquals(0.7, estimator.estimate(frame, "stainless frame", corpus("Frame: stainless steel")));
        assertEquals(0.5, estimator.estimate(frame, "carbon", corpus("Frame: stainless steel")));
    }

    @Test
    void shouldMapConfidenceToLevels() {
        assertEquals("high", ConfidenceEstimator.level(0.8));
        assertEquals("medium", ConfidenceEstimator.level(0.5));
        assertEquals("low", ConfidenceEstimator.level(0.49));
    }

    private static EvidenceCorpus corpus(String text) {
        return EvidenceCorpus.of(text, List.of());
    }
}
