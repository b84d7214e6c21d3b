package io.dsla.rag.retrieval;

/**
 * Available {@link IndexBackend} implementations.
 */
public enum IndexBackendKind {

    /** Flat index whose distance kernels, top-k selection and file codec come from Apache Lucene. */
    EXACT,

    /** Plain Java brute-force scan. */
    LINEAR
}
