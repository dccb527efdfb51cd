package com.quoteflow.extraction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Replays queued answers in order and records every request it receives.
 */
class ScriptedLlmService implements LlmExtractionService {
    private final Deque<Supplier<String>> answers = new ArrayDeque<>();
    final List<ExtractionRequest> requests = new ArrayList<>();

    ScriptedLlmService answer(String raw) {
        answers.add(() -> raw);
        return this;
    }

    ScriptedLlmService fail(RuntimeException failure) {
        answers.add(() -> {
            throw failure;
        });
        return this;
    }

    ScriptedLlmService answerAfter(long delayMs, String raw) {
        answers.add(() -> {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return raw;
        });
        return this;
    }

    @Override
    public synchronized String complete(ExtractionRequest request) {
        requests.add(request);
        Supplier<String> next = answers.poll();
        if (next == null) {
            throw new IllegalStateException("no scripted answer left for " + request.batchId());
        }
        return next.get();
    }

    @Override
    public String modelName() {
        return "scripted";
    }
}
