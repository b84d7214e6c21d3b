package io.dsla.rag.retrieval;

import java.util.List;

/**
 * Strategy abstraction used to turn text into fixed-dimension vectors.
 * Implementations either delegate to an external embedding model or compute
 * deterministic hashed vectors that are suited for tests and offline use.
 */
public interface EmbeddingProvider {

    /**
     * Create one embedding per input text, preserving the input order.
     *
     * @param texts the texts to embed
     * @return the embeddings, each of length {@link #dimension()}
     */
    List<float[]> encode(List<String> texts);

    /**
     * @return the length of every vector produced by this provider
     */
    int dimension();

    /**
     * Create an embedding for a single text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     */
    default float[] encode(String text) {
        return encode(List.of(text)).get(0);
    }
}
