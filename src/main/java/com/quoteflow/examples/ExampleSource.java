package com.quoteflow.examples;

public enum ExampleSource {
    SEED,
    EXTRACTION,
    FEEDBACK
}
