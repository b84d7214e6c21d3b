package io.dsla.rag.retrieval;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Settings for the OpenAI embeddings endpoint. Only read when
 * {@code rag.retrieval.model-name} selects a model as {@code openai:<model>};
 * the model name itself comes from that property, not from here.
 */
@ConfigurationProperties(prefix = "rag.retrieval.openai")
public class OpenAiClientProperties implements EnvironmentAware {

    static final String API_KEY_VARIABLE = "OPENAI_API_KEY";

    /**
     * API key for the embeddings requests. When unset, the
     * {@code OPENAI_API_KEY} environment variable is used.
     */
    private String apiKey;

    /**
     * Base URL of an OpenAI compatible embeddings API.
     */
    private String baseUrl = "https://api.openai.com/v1";

    /**
     * Timeout of a single embeddings request. Documents are embedded in one
     * request per batch, so large batches need a generous value.
     */
    private Duration timeout = Duration.ofSeconds(60);

    /**
     * How often a failed embeddings request is retried before the add or
     * search that triggered it fails.
     */
    private int maxRetries = 3;

    private Environment environment;

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        return environment != null ? environment.getProperty(API_KEY_VARIABLE) : null;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
