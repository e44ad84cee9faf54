package com.libragraph.unpack.formats.api;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Context information about a file being loaded.
 */
public record FileContext(
        String filename,
        Path path,
        Optional<String> contentType
) {
    public static FileContext of(Path path) {
        return new FileContext(path.getFileName().toString(), path, Optional.empty());
    }

    /**
     * Builds a context from a loader request; a blank hint means "unknown".
     */
    public static FileContext of(String filename, String contentType, Path path) {
        Optional<String> hint = contentType == null || contentType.isBlank()
                ? Optional.empty()
                : Optional.of(contentType);
        return new FileContext(filename, path, hint);
    }
}
