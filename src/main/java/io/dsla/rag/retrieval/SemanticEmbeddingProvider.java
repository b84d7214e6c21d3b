package io.dsla.rag.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;

/**
 * {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel}.
 * The model decides the dimension; it is read once at construction. Failures
 * raised by the model are passed through unchanged.
 */
class SemanticEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticEmbeddingProvider.class);

    private final EmbeddingModel model;
    private final String modelName;
    private final int dimension;

    SemanticEmbeddingProvider(EmbeddingModel model, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.modelName = Objects.requireNonNull(modelName, "modelName");
        this.dimension = model.dimension();
        if (dimension <= 0) {
            throw new RetrievalConfigurationException(
                    "Embedding model '" + modelName + "' reported an invalid dimension " + dimension);
        }
        LOGGER.info("Using semantic embeddings from model '{}' with {} dimensions", modelName, dimension);
    }

    @Override
    public List<float[]> encode(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
        List<Embedding> embeddings = model.embedAll(segments).content();
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new IllegalStateException("Embedding model '" + modelName + "' returned "
                    + (embeddings == null ? 0 : embeddings.size()) + " vectors for " + texts.size() + " texts");
        }
        List<float[]> vectors = new ArrayList<>(embeddings.size());
        for (Embedding embedding : embeddings) {
            float[] vector = embedding.vector();
            if (vector.length != dimension) {
                throw new IllegalStateException("Embedding model '" + modelName + "' returned a vector of length "
                        + vector.length + " but declared dimension " + dimension);
            }
            vectors.add(vector);
        }
        LOGGER.debug("Encoded {} texts with model '{}'", texts.size(), modelName);
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    String modelName() {
        return modelName;
    }
}
