package io.dsla.rag.retrieval;

/**
 * Search hit returned by an {@link IndexBackend}: the position of the stored
 * vector and its squared Euclidean distance to the query.
 */
public record Neighbor(int position, float distance) {
}
