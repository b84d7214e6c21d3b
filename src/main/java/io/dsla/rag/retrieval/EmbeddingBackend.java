package io.dsla.rag.retrieval;

/**
 * Embedding strategies selectable through {@code rag.retrieval.embedding-backend}.
 */
public enum EmbeddingBackend {

    SEMANTIC,

    HASHED
}
