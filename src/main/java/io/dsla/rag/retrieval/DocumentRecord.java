package io.dsla.rag.retrieval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A stored document. {@code position} is both its index in the
 * {@link DocumentStore} and the position of its vector in the index backend.
 */
public record DocumentRecord(String text, Map<String, Object> metadata, int position) {

    public DocumentRecord {
        Objects.requireNonNull(text, "text");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
