package io.dsla.rag.retrieval;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Ordered sequence of {@link DocumentRecord}s. Records are only ever appended
 * or removed from the tail, so a record's position never changes while it is
 * stored.
 */
class DocumentStore {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final int FORMAT_VERSION = 1;

    private final List<DocumentRecord> records = new ArrayList<>();

    int size() {
        return records.size();
    }

    DocumentRecord get(int position) {
        return records.get(position);
    }

    /**
     * Append one record per text; {@code metadata} must be {@code null} or have
     * the same size as {@code texts}.
     */
    List<DocumentRecord> append(List<String> texts, List<Map<String, Object>> metadata) {
        List<DocumentRecord> appended = new ArrayList<>(texts.size());
        int position = records.size();
        for (int i = 0; i < texts.size(); i++) {
            appended.add(new DocumentRecord(texts.get(i), metadata == null ? null : metadata.get(i), position + i));
        }
        records.addAll(appended);
        return appended;
    }

    /**
     * Drop every record at or beyond {@code size}.
     */
    void truncate(int size) {
        if (size < 0 || size > records.size()) {
            throw new IllegalArgumentException("size must be between 0 and " + records.size() + " but was " + size);
        }
        records.subList(size, records.size()).clear();
    }

    void clear() {
        records.clear();
    }

    /**
     * Write every record to {@code file}, replacing it. Metadata values go
     * through Jackson untyped, so a value Jackson cannot serialize fails the
     * write with a {@code JsonMappingException}.
     */
    void writeTo(Path file) throws IOException {
        List<StoredDocument> documents = records.stream()
                .map(record -> new StoredDocument(record.text(), record.metadata()))
                .toList();
        MAPPER.writeValue(file.toFile(), new StoredDocuments(FORMAT_VERSION, documents));
    }

    static DocumentStore readFrom(Path file) throws IOException {
        StoredDocuments stored = MAPPER.readValue(file.toFile(), StoredDocuments.class);
        if (stored.version() != FORMAT_VERSION) {
            throw new RetrievalConfigurationException("Document file '" + file + "' has unsupported format version "
                    + stored.version() + " (expected " + FORMAT_VERSION + ")");
        }
        DocumentStore store = new DocumentStore();
        List<StoredDocument> documents = stored.documents() == null ? List.of() : stored.documents();
        for (StoredDocument document : documents) {
            store.records.add(new DocumentRecord(document.text(), document.metadata(), store.records.size()));
        }
        return store;
    }

    record StoredDocuments(int version, List<StoredDocument> documents) {
    }

    record StoredDocument(String text, Map<String, Object> metadata) {
    }
}
