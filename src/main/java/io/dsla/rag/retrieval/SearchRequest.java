package io.dsla.rag.retrieval;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Incoming payload for a similarity search. {@code topK} defaults to
 * {@value #DEFAULT_TOP_K}.
 */
public record SearchRequest(@NotNull String query, @Positive Integer topK) {

    static final int DEFAULT_TOP_K = 5;

    int topKOrDefault() {
        return topK == null ? DEFAULT_TOP_K : topK;
    }
}
