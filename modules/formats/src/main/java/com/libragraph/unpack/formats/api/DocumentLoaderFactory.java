package com.libragraph.unpack.formats.api;

import java.nio.file.Path;

/**
 * Creates a {@link DocumentLoader} for one file on disk.
 *
 * <p>Implementations may be a {@link com.libragraph.unpack.formats.registry.LoaderRegistry}
 * or a plain lambda.
 */
@FunctionalInterface
public interface DocumentLoaderFactory {

    /**
     * @param filename    base file name, without directories
     * @param contentType best-effort MIME hint, empty string when unknown
     * @param path        readable file to load
     */
    DocumentLoader create(String filename, String contentType, Path path);
}
