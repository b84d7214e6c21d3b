package io.dsla.rag.retrieval;

/**
 * Snapshot of the engine state reported by {@code GET /api/rag/status}.
 */
public record RetrievalStatus(int documents, int dimension, IndexBackendKind requestedBackend,
        IndexBackendKind activeBackend, boolean degraded) {

    static RetrievalStatus of(RetrievalEngine engine) {
        return new RetrievalStatus(engine.size(), engine.dimension(), engine.requestedBackend(),
                engine.activeBackend(), engine.isBackendDegraded());
    }
}
