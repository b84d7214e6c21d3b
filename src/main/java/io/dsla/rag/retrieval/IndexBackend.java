package io.dsla.rag.retrieval;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Stores vectors by position and answers nearest neighbour queries using the
 * squared Euclidean distance. Implementations are not thread safe.
 */
public interface IndexBackend {

    /**
     * Append vectors. The whole batch is validated before anything is stored, so
     * a failing call leaves the index unchanged.
     *
     * @param vectors vectors of length {@link #dimension()}
     * @throws IllegalArgumentException if a vector has the wrong length
     */
    void add(List<float[]> vectors);

    /**
     * Find the {@code k} stored vectors closest to {@code query}, ordered by
     * ascending distance. Equal distances are ordered by position.
     *
     * @param query the query vector
     * @param k     maximum number of neighbours, clamped to {@link #count()}
     * @return the neighbours, nearest first
     */
    List<Neighbor> search(float[] query, int k);

    /**
     * Write all vectors to {@code file}, replacing any existing file.
     */
    void save(Path file) throws IOException;

    int count();

    int dimension();

    IndexBackendKind kind();
}
