package com.libragraph.unpack.types;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DocumentTest {

    @Test
    void shouldKeepMetadataInsertionOrder() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("zeta", 1);
        metadata.put("alpha", 2);
        metadata.put("mid", 3);

        Document doc = new Document("text", metadata);

        assertThat(doc.metadata().keySet()).containsExactly("zeta", "alpha", "mid");
    }

    @Test
    void shouldNotSeeLaterChangesToSourceMap() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", "a.txt");

        Document doc = new Document("text", metadata);
        metadata.put("source", "b.txt");

        assertThat(doc.metadata()).containsEntry("source", "a.txt");
    }

    @Test
    void shouldRejectMutation() {
        Document doc = new Document("text", Map.of("k", "v"));

        assertThatThrownBy(() -> doc.metadata().put("k", "other"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldTreatNullMetadataAsEmpty() {
        assertThat(new Document("x", null).metadata()).isEmpty();
        assertThat(Document.of("x").metadata()).isEmpty();
    }

    @Test
    void shouldDeriveCopyWithNewMetadata() {
        Document original = Document.of("hello");
        Document copy = original.withMetadata(Map.of("archive", "a.zip"));

        assertThat(copy.text()).isEqualTo("hello");
        assertThat(copy.metadata()).containsEntry("archive", "a.zip");
        assertThat(original.metadata()).isEmpty();
    }
}
