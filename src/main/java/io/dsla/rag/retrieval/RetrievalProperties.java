package io.dsla.rag.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the retrieval engine, bound from {@code rag.retrieval.*}.
 */
@ConfigurationProperties(prefix = "rag.retrieval")
public class RetrievalProperties {

    /**
     * Embedding strategy: {@code semantic} requires a usable embedding model and
     * fails startup otherwise; {@code hashed} is the deterministic fallback.
     */
    private EmbeddingBackend embeddingBackend = EmbeddingBackend.HASHED;

    /**
     * Identifier of the semantic embedding model.
     */
    private String modelName = SemanticModelFactory.ALL_MINILM_L6_V2;

    /**
     * Vector dimension of the hashed embedding fallback.
     */
    private int hashedDimension = 384;

    /**
     * Base path of the persisted index; {@code .index} and {@code .docs.json} are
     * appended to it.
     */
    private String indexPath = "./data/retrieval_index";

    /**
     * Index backend. A request for {@code exact} degrades to {@code linear} when
     * the exact backend's library is missing.
     */
    private IndexBackendKind indexBackend = IndexBackendKind.EXACT;

    /**
     * Save the index when the application shuts down.
     */
    private boolean saveOnShutdown;

    public EmbeddingBackend getEmbeddingBackend() {
        return embeddingBackend;
    }

    public void setEmbeddingBackend(EmbeddingBackend embeddingBackend) {
        this.embeddingBackend = embeddingBackend;
    }

    public String getModelName() {
        return modelName;
    }

    public void setModelName(String modelName) {
        this.modelName = modelName;
    }

    public int getHashedDimension() {
        return hashedDimension;
    }

    public void setHashedDimension(int hashedDimension) {
        this.hashedDimension = hashedDimension;
    }

    public String getIndexPath() {
        return indexPath;
    }

    public void setIndexPath(String indexPath) {
        this.indexPath = indexPath;
    }

    public IndexBackendKind getIndexBackend() {
        return indexBackend;
    }

    public void setIndexBackend(IndexBackendKind indexBackend) {
        this.indexBackend = indexBackend;
    }

    public boolean isSaveOnShutdown() {
        return saveOnShutdown;
    }

    public void setSaveOnShutdown(boolean saveOnShutdown) {
        this.saveOnShutdown = saveOnShutdown;
    }
}
