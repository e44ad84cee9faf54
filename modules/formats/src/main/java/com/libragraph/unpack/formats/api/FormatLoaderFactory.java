package com.libragraph.unpack.formats.api;

/**
 * Factory for format-specific document loaders.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface FormatLoaderFactory {
    /**
     * Returns criteria for detecting when this factory should be used.
     */
    DetectionCriteria getDetectionCriteria();

    /**
     * Creates a loader bound to the given file.
     */
    DocumentLoader createLoader(FileContext context);
}
