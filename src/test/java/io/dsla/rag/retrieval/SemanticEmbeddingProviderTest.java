package io.dsla.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

class SemanticEmbeddingProviderTest {

    private EmbeddingModel model;

    @BeforeEach
    void setUp() {
        model = mock(EmbeddingModel.class);
        when(model.dimension()).thenReturn(3);
    }

    @Test
    void takesDimensionFromModel() {
        SemanticEmbeddingProvider provider = new SemanticEmbeddingProvider(model, "test-model");

        assertThat(provider.dimension()).isEqualTo(3);
        assertThat(provider.modelName()).isEqualTo("test-model");
    }

    @Test
    void returnsVectorsInInputOrder() {
        when(model.embedAll(anyList())).thenAnswer(invocation -> {
            List<TextSegment> segments = invocation.getArgument(0);
            List<Embedding> embeddings = segments.stream()
                    .map(segment -> Embedding.from(new float[] { segment.text().length(), 0f, 1f }))
                    .toList();
            return Response.from(embeddings);
        });
        SemanticEmbeddingProvider provider = new SemanticEmbeddingProvider(model, "test-model");

        List<float[]> vectors = provider.encode(List.of("a", "abc", "ab"));

        assertThat(vectors).hasSize(3);
        assertThat(vectors.get(0)).containsExactly(1f, 0f, 1f);
        assertThat(vectors.get(1)).containsExactly(3f, 0f, 1f);
        assertThat(vectors.get(2)).containsExactly(2f, 0f, 1f);
        assertThat(provider.encode("abcd")).containsExactly(4f, 0f, 1f);
    }

    @Test
    void skipsModelForEmptyBatch() {
        SemanticEmbeddingProvider provider = new SemanticEmbeddingProvider(model, "test-model");

        assertThat(provider.encode(List.of())).isEmpty();
        verify(model, never()).embedAll(anyList());
    }

    @Test
    void rejectsMissingVectors() {
        when(model.embedAll(anyList()))
                .thenReturn(Response.from(List.of(Embedding.from(new float[] { 1f, 0f, 0f }))));
        SemanticEmbeddingProvider provider = new SemanticEmbeddingProvider(model, "test-model");

        assertThatThrownBy(() -> provider.encode(List.of("one", "two")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("returned 1 vectors for 2 texts");
    }

    @Test
    void rejectsVectorsOfWrongLength() {
        when(model.embedAll(anyList())).thenReturn(Response.from(List.of(Embedding.from(new float[] { 1f, 0f }))));
        SemanticEmbeddingProvider provider = new SemanticEmbeddingProvider(model, "test-model");

        assertThatThrownBy(() -> provider.encode(List.of("one")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("length 2")
                .hasMessageContaining("dimension 3");
    }

    @Test
    void passesModelFailuresThrough() {
        RuntimeException failure = new RuntimeException("connection refused");
        when(model.embedAll(anyList())).thenThrow(failure);
        SemanticEmbeddingProvider provider = new SemanticEmbeddingProvider(model, "test-model");

        assertThatThrownBy(() -> provider.encode(List.of("one"))).isSameAs(failure);
    }

    @Test
    void rejectsModelWithoutDimension() {
        when(model.dimension()).thenReturn(0);

        assertThatThrownBy(() -> new SemanticEmbeddingProvider(model, "broken"))
                .isInstanceOf(RetrievalConfigurationException.class)
                .hasMessageContaining("broken");
    }
}
