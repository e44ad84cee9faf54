package com.libragraph.unpack.extract;

import com.libragraph.unpack.types.Document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stamps archive provenance onto loader output.
 *
 * <p>Keys the loader already set win; provenance keys are only added when absent.
 */
public final class MetadataEnricher {

    public static final String ARCHIVE = "archive";
    public static final String ARCHIVE_MEMBER = "archive_member";
    public static final String SOURCE = "source";

    private MetadataEnricher() {
    }

    public static Document enrich(Document document, String archiveName, String memberName) {
        Map<String, Object> provenance = new LinkedHashMap<>();
        provenance.put(ARCHIVE, archiveName);
        provenance.put(ARCHIVE_MEMBER, memberName);
        provenance.put(SOURCE, archiveName + "::" + memberName);
        return document.withMetadata(mergeAbsent(document.metadata(), provenance));
    }

    public static List<Document> enrichAll(List<Document> documents, String archiveName, String memberName) {
        List<Document> enriched = new ArrayList<>(documents.size());
        for (Document document : documents) {
            enriched.add(enrich(document, archiveName, memberName));
        }
        return enriched;
    }

    /**
     * Returns {@code base} followed by every entry of {@code additions} whose key
     * {@code base} does not contain. A key mapped to null in {@code base} counts as set.
     */
    static Map<String, Object> mergeAbsent(Map<String, Object> base, Map<String, Object> additions) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        additions.forEach((key, value) -> {
            if (!base.containsKey(key)) {
                merged.put(key, value);
            }
        });
        return merged;
    }
}
