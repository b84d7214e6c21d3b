package io.dsla.rag.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

/**
 * Saves the retrieval index when the application context is closed. Only
 * registered when {@code rag.retrieval.save-on-shutdown=true}.
 */
class IndexFlushOnShutdown implements DisposableBean {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexFlushOnShutdown.class);

    private final RetrievalEngine retrievalEngine;

    IndexFlushOnShutdown(RetrievalEngine retrievalEngine) {
        this.retrievalEngine = retrievalEngine;
    }

    @Override
    public void destroy() throws Exception {
        LOGGER.info("Saving retrieval index before shutdown");
        retrievalEngine.save();
    }
}
