package com.libragraph.unpack.extract;

import com.libragraph.unpack.formats.api.DocumentLoader;
import com.libragraph.unpack.formats.api.DocumentLoaderFactory;
import com.libragraph.unpack.types.Document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loader factory that records every request and returns one document holding
 * the file's text. Names listed in {@code failing} throw from {@code load()}.
 */
public class RecordingLoaderFactory implements DocumentLoaderFactory {

    public record Request(String filename, String contentType, Path path) {}

    private final List<Request> requests = new ArrayList<>();
    private final Set<String> failing;

    public RecordingLoaderFactory() {
        this(Set.of());
    }

    public RecordingLoaderFactory(Set<String> failing) {
        this.failing = failing;
    }

    @Override
    public DocumentLoader create(String filename, String contentType, Path path) {
        requests.add(new Request(filename, contentType, path));
        return () -> {
            if (failing.contains(filename)) {
                throw new IOException("Corrupt file: " + filename);
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("filename", filename);
            return List.of(new Document(Files.readString(path), metadata));
        };
    }

    public List<Request> requests() {
        return requests;
    }

    public List<String> filenames() {
        return requests.stream().map(Request::filename).toList();
    }
}
