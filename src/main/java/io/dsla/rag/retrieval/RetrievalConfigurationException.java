package io.dsla.rag.retrieval;

/**
 * Raised when the retrieval engine cannot be constructed or loaded with the
 * current configuration: unknown embedding backend, invalid numeric settings,
 * or a persisted index that does not match the configured embedding provider.
 * It is never recovered from internally.
 */
public class RetrievalConfigurationException extends RuntimeException {

    public RetrievalConfigurationException(String message) {
        super(message);
    }

    public RetrievalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
