package io.dsla.rag.retrieval;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Indexes documents and answers nearest neighbour queries over their
 * embeddings. Every stored document has a vector at the same position in the
 * index backend; {@link #add(List, List)} keeps that alignment even when the
 * backend rejects a batch.
 * <p>
 * The engine does no locking. Callers that share it between threads must
 * serialize {@code add}, {@code clear} and {@code save} against each other and
 * against {@code search}.
 */
public class RetrievalEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalEngine.class);

    static final String INDEX_SUFFIX = ".index";
    static final String DOCUMENTS_SUFFIX = ".docs.json";
    static final String STAGING_SUFFIX = ".saving";

    private final EmbeddingProvider embeddingProvider;
    private final IndexBackendSelector backendSelector;
    private final Path indexFile;
    private final Path documentsFile;
    private final DocumentStore store;
    private IndexBackend backend;

    private RetrievalEngine(EmbeddingProvider embeddingProvider, IndexBackendSelector backendSelector, Path indexPath,
            DocumentStore store, IndexBackend backend) {
        this.embeddingProvider = embeddingProvider;
        this.backendSelector = backendSelector;
        this.indexFile = indexFile(indexPath);
        this.documentsFile = documentsFile(indexPath);
        this.store = store;
        this.backend = backend;
    }

    /**
     * Create an engine for {@code indexPath}. When {@code indexPath.index} exists
     * the engine starts with the persisted documents; otherwise it starts empty.
     *
     * @throws RetrievalConfigurationException if the persisted index does not
     *         match the provider's dimension or the persisted files disagree
     */
    public static RetrievalEngine open(EmbeddingProvider embeddingProvider, IndexBackendSelector backendSelector,
            Path indexPath) throws IOException {
        Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        Objects.requireNonNull(backendSelector, "backendSelector");
        Objects.requireNonNull(indexPath, "indexPath");
        Path indexFile = indexFile(indexPath);
        Path documentsFile = documentsFile(indexPath);

        if (!Files.exists(indexFile)) {
            if (Files.exists(documentsFile)) {
                throw new RetrievalConfigurationException("Document file '" + documentsFile.toAbsolutePath()
                        + "' exists but index file '" + indexFile.toAbsolutePath()
                        + "' is missing. Rebuild the index or remove the document file");
            }
            LOGGER.info("Starting with an empty {} index of dimension {} (no index at {})",
                    backendSelector.active(), embeddingProvider.dimension(), indexFile.toAbsolutePath());
            return new RetrievalEngine(embeddingProvider, backendSelector, indexPath, new DocumentStore(),
                    backendSelector.create(embeddingProvider.dimension()));
        }

        IndexBackend backend = backendSelector.read(indexFile);
        if (backend.dimension() != embeddingProvider.dimension()) {
            throw new RetrievalConfigurationException("Index dimension " + backend.dimension()
                    + " does not match embedding dimension " + embeddingProvider.dimension() + " for index at '"
                    + indexFile.toAbsolutePath() + "'. If you changed the embedding model or the hashed dimension, "
                    + "delete or rebuild this index file; otherwise fix the embedding configuration");
        }
        if (!Files.exists(documentsFile)) {
            throw new RetrievalConfigurationException("Index file '" + indexFile.toAbsolutePath()
                    + "' has no document file at '" + documentsFile.toAbsolutePath() + "'. Rebuild the index");
        }
        DocumentStore store = DocumentStore.readFrom(documentsFile);
        if (store.size() != backend.count()) {
            throw new RetrievalConfigurationException("Document file '" + documentsFile.toAbsolutePath() + "' holds "
                    + store.size() + " documents but index file '" + indexFile.toAbsolutePath() + "' holds "
                    + backend.count() + " vectors. Rebuild the index");
        }
        LOGGER.info("Loaded {} documents into the {} index from {}", store.size(), backend.kind(),
                indexFile.toAbsolutePath());
        return new RetrievalEngine(embeddingProvider, backendSelector, indexPath, store, backend);
    }

    public void add(List<String> documents) {
        add(documents, null);
    }

    /**
     * Encode and index {@code documents}. Either every document is added or,
     * if encoding or indexing fails, none is.
     *
     * @param documents texts to index
     * @param metadata  one map per document, or {@code null} for empty metadata.
     *                  Values should be JSON types (strings, numbers, booleans,
     *                  lists and maps of those): {@link #save()} stores them
     *                  with Jackson, so after a reload a {@code Float} comes back
     *                  as a {@code Double}, other objects come back as maps, and
     *                  values Jackson cannot serialize make {@code save()} fail
     * @throws IllegalArgumentException if {@code metadata} and {@code documents}
     *         differ in size or a document is {@code null}
     */
    public void add(List<String> documents, List<Map<String, Object>> metadata) {
        if (documents == null) {
            throw new IllegalArgumentException("documents must not be null");
        }
        if (documents.isEmpty()) {
            return;
        }
        if (metadata != null && metadata.size() != documents.size()) {
            throw new IllegalArgumentException("metadata must have the same size as documents: " + metadata.size()
                    + " metadata entries for " + documents.size() + " documents");
        }
        for (int i = 0; i < documents.size(); i++) {
            if (documents.get(i) == null) {
                throw new IllegalArgumentException("documents[" + i + "] must not be null");
            }
        }

        List<float[]> vectors = embeddingProvider.encode(documents);
        if (vectors.size() != documents.size()) {
            throw new IllegalStateException("Embedding provider returned " + vectors.size() + " vectors for "
                    + documents.size() + " documents");
        }

        int previousSize = store.size();
        store.append(documents, metadata);
        try {
            backend.add(vectors);
        } catch (RuntimeException ex) {
            store.truncate(previousSize);
            throw ex;
        }
        LOGGER.debug("Added {} documents, {} stored", documents.size(), store.size());
    }

    /**
     * Find the documents closest to {@code query}.
     *
     * @param query the query text
     * @param topK  maximum number of results; clamped to the document count
     * @return results ordered by ascending squared Euclidean distance, empty if
     *         nothing is indexed
     */
    public List<RetrievedDocument> search(String query, int topK) {
        if (query == null) {
            throw new IllegalArgumentException("query must not be null");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive but was " + topK);
        }
        if (store.size() == 0) {
            return List.of();
        }
        int limit = Math.min(topK, store.size());
        float[] queryVector = embeddingProvider.encode(query);
        List<Neighbor> neighbors = backend.search(queryVector, limit);
        List<RetrievedDocument> results = new ArrayList<>(neighbors.size());
        for (Neighbor neighbor : neighbors) {
            DocumentRecord record = store.get(neighbor.position());
            results.add(new RetrievedDocument(record.text(), neighbor.distance(), record.metadata()));
        }
        LOGGER.debug("Search with topK={} returned {} of {} documents", topK, results.size(), store.size());
        return results;
    }

    /**
     * Write the index and the documents next to the configured index path,
     * creating parent directories as needed. Both files are written under
     * staging names first and only replace the previous snapshot once both
     * writes have succeeded; a failed save leaves the previous snapshot as it
     * was.
     */
    public void save() throws IOException {
        Path parent = indexFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path stagedIndex = staged(indexFile);
        Path stagedDocuments = staged(documentsFile);
        try {
            backend.save(stagedIndex);
            store.writeTo(stagedDocuments);
            Files.move(stagedIndex, indexFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            Files.move(stagedDocuments, documentsFile, StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException ex) {
            discard(stagedIndex, ex);
            discard(stagedDocuments, ex);
            LOGGER.error("Saving the retrieval index to {} failed", indexFile.toAbsolutePath(), ex);
            throw ex;
        }
        LOGGER.info("Saved {} documents to {}", store.size(), indexFile.toAbsolutePath());
    }

    private static Path staged(Path file) {
        return file.resolveSibling(file.getFileName() + STAGING_SUFFIX);
    }

    private static void discard(Path file, Exception failure) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            failure.addSuppressed(ex);
        }
    }

    /**
     * Remove every document and start over with an empty index of the same
     * dimension. Files written by {@link #save()} are left untouched.
     */
    public void clear() {
        store.clear();
        backend = backendSelector.create(embeddingProvider.dimension());
        LOGGER.info("Cleared the retrieval index");
    }

    public float[] getEmbedding(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
        return embeddingProvider.encode(text);
    }

    public List<float[]> getEmbeddings(List<String> texts) {
        if (texts == null) {
            throw new IllegalArgumentException("texts must not be null");
        }
        return embeddingProvider.encode(texts);
    }

    public int size() {
        return store.size();
    }

    public int dimension() {
        return embeddingProvider.dimension();
    }

    public IndexBackendKind requestedBackend() {
        return backendSelector.requested();
    }

    public IndexBackendKind activeBackend() {
        return backend.kind();
    }

    /**
     * @return {@code true} if the exact backend was requested but the linear
     *         backend is in use because the exact backend's library is missing
     */
    public boolean isBackendDegraded() {
        return backendSelector.isDegraded();
    }

    Path indexFile() {
        return indexFile;
    }

    Path documentsFile() {
        return documentsFile;
    }

    private static Path indexFile(Path indexPath) {
        return indexPath.resolveSibling(indexPath.getFileName() + INDEX_SUFFIX);
    }

    private static Path documentsFile(Path indexPath) {
        return indexPath.resolveSibling(indexPath.getFileName() + DOCUMENTS_SUFFIX);
    }
}
