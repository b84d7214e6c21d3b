package io.dsla.rag.retrieval;

import java.io.IOException;
import java.nio.file.Path;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.langchain4j.model.embedding.EmbeddingModel;

/**
 * Central configuration wiring the retrieval components together. Toggles
 * decide which embedding strategy and which index backend are used; the engine
 * is created eagerly so configuration errors stop the application at startup.
 */
@Configuration
@EnableConfigurationProperties({ RetrievalProperties.class, OpenAiClientProperties.class })
public class RetrievalConfiguration {

    @Bean
    @ConditionalOnProperty(name = "rag.retrieval.embedding-backend", havingValue = "hashed", matchIfMissing = true)
    public EmbeddingProvider hashedEmbeddingProvider(RetrievalProperties properties) {
        return new HashedEmbeddingProvider(properties.getHashedDimension());
    }

    /**
     * Uses an application supplied {@link EmbeddingModel} bean when there is one,
     * labelled with its class name; otherwise resolves
     * {@code rag.retrieval.model-name}.
     */
    @Bean
    @ConditionalOnProperty(name = "rag.retrieval.embedding-backend", havingValue = "semantic")
    public EmbeddingProvider semanticEmbeddingProvider(RetrievalProperties properties,
            OpenAiClientProperties openAiProperties, ObjectProvider<EmbeddingModel> embeddingModel) {
        EmbeddingModel supplied = embeddingModel.getIfAvailable();
        if (supplied != null) {
            return new SemanticEmbeddingProvider(supplied, supplied.getClass().getName());
        }
        String modelName = properties.getModelName();
        return new SemanticEmbeddingProvider(new SemanticModelFactory(openAiProperties).create(modelName), modelName);
    }

    @Bean
    public IndexBackendSelector indexBackendSelector(RetrievalProperties properties) {
        return IndexBackendSelector.detect(properties.getIndexBackend());
    }

    @Bean
    public RetrievalEngine retrievalEngine(RetrievalProperties properties,
            ObjectProvider<EmbeddingProvider> embeddingProvider, IndexBackendSelector indexBackendSelector)
            throws IOException {
        EmbeddingProvider provider = embeddingProvider.getIfAvailable();
        if (provider == null) {
            throw new RetrievalConfigurationException("No embedding provider for rag.retrieval.embedding-backend="
                    + properties.getEmbeddingBackend());
        }
        return RetrievalEngine.open(provider, indexBackendSelector, Path.of(properties.getIndexPath()));
    }

    @Bean
    @ConditionalOnProperty(name = "rag.retrieval.save-on-shutdown", havingValue = "true")
    IndexFlushOnShutdown indexFlushOnShutdown(RetrievalEngine retrievalEngine) {
        return new IndexFlushOnShutdown(retrievalEngine);
    }
}
