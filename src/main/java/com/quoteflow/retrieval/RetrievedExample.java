package com.quoteflow.retrieval;

import com.quoteflow.examples.Example;

public record RetrievedExample(Example example, float similarity, double score) {
}
