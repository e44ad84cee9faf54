package com.libragraph.unpack.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of extracted text plus its provenance metadata.
 *
 * <p>Metadata keeps insertion order and is never mutated in place; use
 * {@link #withMetadata(Map)} to derive a copy with additional keys.
 *
 * @param text     extracted text, never null (may be empty)
 * @param metadata ordered, unmodifiable metadata mapping
 */
public record Document(
        String text,
        Map<String, Object> metadata
) {
    public Document {
        Objects.requireNonNull(text, "text");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Document of(String text) {
        return new Document(text, Map.of());
    }

    /**
     * Returns a copy of this document whose metadata is exactly {@code metadata}.
     */
    public Document withMetadata(Map<String, Object> metadata) {
        return new Document(text, metadata);
    }
}
