package io.dsla.rag.retrieval;

import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;

/**
 * Resolves a model identifier to a LangChain4j {@link EmbeddingModel}.
 * <ul>
 * <li>{@code sentence-transformers/all-MiniLM-L6-v2} (or {@code all-MiniLM-L6-v2}) runs in-process.</li>
 * <li>{@code openai:<model>} calls the OpenAI embeddings API.</li>
 * </ul>
 * Anything else is rejected when the application starts.
 */
class SemanticModelFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticModelFactory.class);

    static final String ALL_MINILM_L6_V2 = "sentence-transformers/all-MiniLM-L6-v2";

    private static final String OPENAI_PREFIX = "openai:";

    private final OpenAiClientProperties openAiProperties;

    SemanticModelFactory(OpenAiClientProperties openAiProperties) {
        this.openAiProperties = Objects.requireNonNull(openAiProperties, "openAiProperties");
    }

    EmbeddingModel create(String modelName) {
        if (!StringUtils.hasText(modelName)) {
            throw new RetrievalConfigurationException(
                    "Property 'rag.retrieval.model-name' must be provided when the semantic embedding backend is used");
        }
        String normalized = modelName.trim();
        if (isAllMiniLm(normalized)) {
            return inProcessAllMiniLm(normalized);
        }
        if (normalized.startsWith(OPENAI_PREFIX)) {
            return openAi(normalized.substring(OPENAI_PREFIX.length()));
        }
        throw new RetrievalConfigurationException("Unknown embedding model '" + modelName + "'. Use '"
                + ALL_MINILM_L6_V2 + "' or 'openai:<model-name>', or switch rag.retrieval.embedding-backend to hashed");
    }

    private boolean isAllMiniLm(String modelName) {
        String lower = modelName.toLowerCase(Locale.ROOT);
        return lower.equals(ALL_MINILM_L6_V2.toLowerCase(Locale.ROOT)) || lower.equals("all-minilm-l6-v2");
    }

    private EmbeddingModel inProcessAllMiniLm(String modelName) {
        LOGGER.info("Loading in-process embedding model '{}'", modelName);
        try {
            return new AllMiniLmL6V2EmbeddingModel();
        } catch (LinkageError ex) {
            throw new RetrievalConfigurationException("Embedding model '" + modelName
                    + "' is not available on the classpath. Add langchain4j-embeddings-all-minilm-l6-v2 "
                    + "or switch rag.retrieval.embedding-backend to hashed", ex);
        }
    }

    private EmbeddingModel openAi(String openAiModel) {
        if (!StringUtils.hasText(openAiModel)) {
            throw new RetrievalConfigurationException("OpenAI embedding model name is missing after 'openai:'");
        }
        String apiKey = openAiProperties.getApiKey();
        if (!StringUtils.hasText(apiKey)) {
            throw new RetrievalConfigurationException(
                    "Property 'rag.retrieval.openai.api-key' (or " + OpenAiClientProperties.API_KEY_VARIABLE
                            + ") must be provided for model 'openai:"
                            + openAiModel + "'");
        }
        LOGGER.info("Using OpenAI embedding model '{}' via base URL {}", openAiModel, openAiProperties.getBaseUrl());
        return OpenAiEmbeddingModel.builder()
                .apiKey(apiKey)
                .baseUrl(openAiProperties.getBaseUrl())
                .modelName(openAiModel)
                .timeout(openAiProperties.getTimeout())
                .maxRetries(openAiProperties.getMaxRetries())
                .build();
    }
}
