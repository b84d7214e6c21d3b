package io.dsla.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void assignsConsecutivePositions() {
        DocumentStore store = new DocumentStore();
        store.append(List.of("a", "b"), null);
        List<DocumentRecord> appended = store.append(List.of("c"), List.of(Map.of("source", "test")));

        assertThat(store.size()).isEqualTo(3);
        assertThat(appended).containsExactly(new DocumentRecord("c", Map.of("source", "test"), 2));
        assertThat(store.get(0)).isEqualTo(new DocumentRecord("a", Map.of(), 0));
        assertThat(store.get(1).position()).isEqualTo(1);
    }

    @Test
    void truncatesTail() {
        DocumentStore store = new DocumentStore();
        store.append(List.of("a", "b", "c"), null);

        store.truncate(1);

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get(0).text()).isEqualTo("a");
        assertThatThrownBy(() -> store.truncate(2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copiesMetadata() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("source", "original");
        List<Map<String, Object>> metadataList = new ArrayList<>();
        metadataList.add(metadata);
        DocumentStore store = new DocumentStore();
        store.append(List.of("a"), metadataList);

        metadata.put("source", "changed");

        assertThat(store.get(0).metadata()).containsEntry("source", "original");
        assertThatThrownBy(() -> store.get(0).metadata().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void writesAndReadsDocumentsAsJson() throws IOException {
        DocumentStore store = new DocumentStore();
        store.append(List.of("Doc 1", "Doc 2"),
                List.of(Map.of("source", "test1", "page", 3), Map.of("tags", List.of("a", "b"))));
        Path file = tempDir.resolve("store.docs.json");

        store.writeTo(file);
        DocumentStore restored = DocumentStore.readFrom(file);

        assertThat(restored.size()).isEqualTo(2);
        assertThat(restored.get(0)).isEqualTo(new DocumentRecord("Doc 1", Map.of("source", "test1", "page", 3), 0));
        assertThat(restored.get(1).metadata()).containsEntry("tags", List.of("a", "b"));
        assertThat(Files.readString(file)).contains("\"version\":1");
    }

    @Test
    void rejectsUnknownFormatVersion() throws IOException {
        Path file = tempDir.resolve("future.docs.json");
        Files.writeString(file, "{\"version\":99,\"documents\":[]}");

        assertThatThrownBy(() -> DocumentStore.readFrom(file))
                .isInstanceOf(RetrievalConfigurationException.class)
                .hasMessageContaining("format version 99");
    }
}
