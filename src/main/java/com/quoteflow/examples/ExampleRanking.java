package com.quoteflow.examples;

import java.util.Comparator;

public final class ExampleRanking {
    public static final Comparator<Example> BY_QUALITY_THEN_RECENCY = Comparator
            .comparingDouble(ExampleRanking::quality).reversed()
            .thenComparing(Example::createdAt, Comparator.reverseOrder());

    private ExampleRanking() {
    }

    public static double quality(Example example) {
        return (example.confidenceScore() + example.successRate()) / 2.0;
    }
}
