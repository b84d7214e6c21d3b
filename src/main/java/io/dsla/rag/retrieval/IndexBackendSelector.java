package io.dsla.rag.retrieval;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which {@link IndexBackend} is used. Whether the exact backend's
 * library can be loaded is checked once, when the selector is created; a
 * request for the exact backend then degrades to {@link IndexBackendKind#LINEAR}
 * if it cannot, and {@link #isDegraded()} reports it.
 */
public class IndexBackendSelector {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexBackendSelector.class);

    private static final String EXACT_LIBRARY_CLASS = "org.apache.lucene.util.VectorUtil";

    private final IndexBackendKind requested;
    private final IndexBackendKind active;

    IndexBackendSelector(IndexBackendKind requested, boolean exactLibraryAvailable) {
        this.requested = Objects.requireNonNull(requested, "requested");
        if (requested == IndexBackendKind.EXACT && !exactLibraryAvailable) {
            LOGGER.warn("Exact index backend requested but Apache Lucene is not available; "
                    + "falling back to the linear index backend");
            this.active = IndexBackendKind.LINEAR;
        } else {
            this.active = requested;
        }
    }

    /**
     * Create a selector for {@code requested}, checking the classpath for the
     * exact backend's library.
     */
    public static IndexBackendSelector detect(IndexBackendKind requested) {
        return new IndexBackendSelector(requested, exactLibraryAvailable());
    }

    static boolean exactLibraryAvailable() {
        try {
            Class.forName(EXACT_LIBRARY_CLASS, false, IndexBackendSelector.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError ex) {
            LOGGER.debug("Exact index library not loadable: {}", ex.toString());
            return false;
        }
    }

    IndexBackend create(int dimension) {
        return active == IndexBackendKind.EXACT ? new ExactIndex(dimension) : new LinearIndex(dimension);
    }

    IndexBackend read(Path file) throws IOException {
        return active == IndexBackendKind.EXACT ? ExactIndex.read(file) : LinearIndex.read(file);
    }

    public IndexBackendKind requested() {
        return requested;
    }

    public IndexBackendKind active() {
        return active;
    }

    public boolean isDegraded() {
        return requested != active;
    }
}
