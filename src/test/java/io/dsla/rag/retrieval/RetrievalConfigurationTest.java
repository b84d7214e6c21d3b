package io.dsla.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import dev.langchain4j.model.embedding.EmbeddingModel;

class RetrievalConfigurationTest {

    @TempDir
    Path tempDir;

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
                .withUserConfiguration(RetrievalConfiguration.class)
                .withPropertyValues("rag.retrieval.index-path=" + tempDir.resolve("index"));
    }

    @Test
    void usesHashedEmbeddingsAndExactIndexByDefault() {
        contextRunner().run(context -> {
            assertThat(context).hasSingleBean(EmbeddingProvider.class);
            assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(HashedEmbeddingProvider.class);
            assertThat(context).doesNotHaveBean(IndexFlushOnShutdown.class);

            RetrievalEngine engine = context.getBean(RetrievalEngine.class);
            assertThat(engine.dimension()).isEqualTo(384);
            assertThat(engine.activeBackend()).isEqualTo(IndexBackendKind.EXACT);
            assertThat(engine.isBackendDegraded()).isFalse();
        });
    }

    @Test
    void honoursHashedDimensionAndLinearBackend() {
        contextRunner()
                .withPropertyValues("rag.retrieval.hashed-dimension=128", "rag.retrieval.index-backend=linear")
                .run(context -> {
                    RetrievalEngine engine = context.getBean(RetrievalEngine.class);
                    assertThat(engine.dimension()).isEqualTo(128);
                    assertThat(engine.requestedBackend()).isEqualTo(IndexBackendKind.LINEAR);
                    assertThat(engine.activeBackend()).isEqualTo(IndexBackendKind.LINEAR);
                });
    }

    @Test
    void usesSuppliedEmbeddingModelForSemanticBackend() {
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.dimension()).thenReturn(8);

        contextRunner()
                .withBean(EmbeddingModel.class, () -> model)
                .withPropertyValues("rag.retrieval.embedding-backend=semantic")
                .run(context -> {
                    assertThat(context).hasSingleBean(EmbeddingProvider.class);
                    assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(SemanticEmbeddingProvider.class);
                    SemanticEmbeddingProvider provider = (SemanticEmbeddingProvider) context
                            .getBean(EmbeddingProvider.class);
                    assertThat(provider.modelName()).isEqualTo(model.getClass().getName())
                            .isNotEqualTo(SemanticModelFactory.ALL_MINILM_L6_V2);
                    assertThat(context.getBean(RetrievalEngine.class).dimension()).isEqualTo(8);
                });
    }

    @Test
    void bindsOpenAiSettings() {
        contextRunner()
                .withPropertyValues("rag.retrieval.openai.api-key=test-key", "rag.retrieval.openai.timeout=15s",
                        "rag.retrieval.openai.max-retries=1")
                .run(context -> {
                    OpenAiClientProperties properties = context.getBean(OpenAiClientProperties.class);
                    assertThat(properties.getApiKey()).isEqualTo("test-key");
                    assertThat(properties.getBaseUrl()).isEqualTo("https://api.openai.com/v1");
                    assertThat(properties.getTimeout()).isEqualTo(Duration.ofSeconds(15));
                    assertThat(properties.getMaxRetries()).isEqualTo(1);
                });
    }

    @Test
    void fallsBackToEnvironmentForOpenAiKey() {
        contextRunner()
                .withPropertyValues("OPENAI_API_KEY=from-environment")
                .run(context -> assertThat(context.getBean(OpenAiClientProperties.class).getApiKey())
                        .isEqualTo("from-environment"));
    }

    @Test
    void failsStartupForUnknownSemanticModel() {
        contextRunner()
                .withPropertyValues("rag.retrieval.embedding-backend=semantic", "rag.retrieval.model-name=no-such-model")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).rootCause()
                            .isInstanceOf(RetrievalConfigurationException.class)
                            .hasMessageContaining("no-such-model");
                });
    }

    @Test
    void failsStartupForInvalidHashedDimension() {
        contextRunner()
                .withPropertyValues("rag.retrieval.hashed-dimension=0")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).rootCause()
                            .isInstanceOf(RetrievalConfigurationException.class);
                });
    }

    @Test
    void failsStartupWhenPersistedIndexHasOtherDimension() throws Exception {
        RetrievalEngine engine = RetrievalEngine.open(new HashedEmbeddingProvider(384),
                new IndexBackendSelector(IndexBackendKind.EXACT, true), tempDir.resolve("index"));
        engine.add(List.of("persisted"));
        engine.save();

        contextRunner()
                .withPropertyValues("rag.retrieval.hashed-dimension=256")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).rootCause()
                            .isInstanceOf(RetrievalConfigurationException.class)
                            .hasMessageContaining("384")
                            .hasMessageContaining("256");
                });
    }

    @Test
    void savesIndexOnShutdownWhenEnabled() {
        contextRunner()
                .withPropertyValues("rag.retrieval.save-on-shutdown=true")
                .run(context -> {
                    assertThat(context).hasSingleBean(IndexFlushOnShutdown.class);
                    context.getBean(RetrievalEngine.class).add(List.of("kept across restarts"));
                });

        assertThat(tempDir.resolve("index.index")).exists();
        assertThat(tempDir.resolve("index.docs.json")).exists();

        contextRunner().run(context -> {
            RetrievalEngine engine = context.getBean(RetrievalEngine.class);
            assertThat(engine.size()).isEqualTo(1);
            assertThat(engine.search("kept across restarts", 1))
                    .extracting(RetrievedDocument::text)
                    .containsExactly("kept across restarts");
        });
    }
}
