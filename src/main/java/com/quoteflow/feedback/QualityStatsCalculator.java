package com.quoteflow.feedback;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import com.quoteflow.examples.Example;

public class QualityStatsCalculator {

    public QualityStats compute(Collection<Example> examples) {
        Map<QualityTier, Integer> tiers = new EnumMap<>(QualityTier.class);
        for (QualityTier tier : QualityTier.values()) {
            tiers.put(tier, 0);
        }
        int deprioritized = 0;
        for (Example example : examples) {
            tiers.merge(QualityTier.of(example.confidenceScore()), 1, Integer::sum);
            if (example.deprioritized()) {
                deprioritized++;
            }
        }

        Map<String, List<Example>> byField = examples.stream()
                .collect(Collectors.groupingBy(Example::fieldName, TreeMap::new, Collectors.toList()));
        Map<String, QualityStats.FieldQuality> perField = new TreeMap<>();
        byField.forEach((field, fieldExamples) -> perField.put(field, summarize(fieldExamples)));

        QualityStats.FieldQuality overall = summarize(examples);
        return new QualityStats(
                examples.size(),
                overall.successRate(),
                overall.avgConfidence(),
                perField,
                tiers,
                deprioritized);
    }

    private static QualityStats.FieldQuality summarize(Collection<Example> examples) {
        int usage = 0;
        int success = 0;
        double confidence = 0.0;
        for (Example example : examples) {
            usage += example.usageCount();
            success += example.successCount();
            confidence += example.confidenceScore();
        }
        double successRate = usage == 0 ? 0.0 : (double) success / usage;
        double avgConfidence = examples.isEmpty() ? 0.0 : confidence / examples.size();
        return new QualityStats.FieldQuality(examples.size(), usage, success, successRate, avgConfidence);
    }
}
