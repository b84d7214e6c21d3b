package io.dsla.rag.retrieval;

import java.util.List;
import java.util.Map;

/**
 * Search results as returned over HTTP, nearest first.
 */
public record SearchResponse(List<Hit> results) {

    static SearchResponse of(List<RetrievedDocument> documents) {
        return new SearchResponse(documents.stream()
                .map(document -> new Hit(document.text(), document.distance(), document.metadata()))
                .toList());
    }

    /**
     * A single result; {@code distance} is a squared Euclidean distance.
     */
    public record Hit(String document, double distance, Map<String, Object> metadata) {
    }
}
