package io.dsla.rag.retrieval;

import java.util.Map;

/**
 * Search result returned by the {@link RetrievalEngine}.
 *
 * @param text     the stored document text
 * @param distance squared Euclidean distance between query and document
 *                 embeddings; smaller is closer and the value is not bounded,
 *                 so it must not be read as a similarity or a probability
 * @param metadata the metadata stored with the document
 */
public record RetrievedDocument(String text, double distance, Map<String, Object> metadata) {
}
