package io.dsla.rag.retrieval;

import java.util.List;
import java.util.Map;

import jakarta.validation.constraints.NotNull;

/**
 * Incoming payload for indexing documents. {@code metadata} is optional and,
 * when present, holds one map per document.
 */
public record AddDocumentsRequest(@NotNull List<String> documents, List<Map<String, Object>> metadata) {
}
