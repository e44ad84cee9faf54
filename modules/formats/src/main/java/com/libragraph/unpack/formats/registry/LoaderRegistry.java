package com.libragraph.unpack.formats.registry;

import com.libragraph.unpack.formats.api.*;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Central registry that matches files to format loader factories.
 * All {@link FormatLoaderFactory} beans are discovered via CDI.
 *
 * <p>As a {@link DocumentLoaderFactory} it is the default loader injected into
 * archive extraction jobs.
 */
@ApplicationScoped
public class LoaderRegistry implements DocumentLoaderFactory {

    private final List<FormatLoaderFactory> factories;

    protected LoaderRegistry() {
        this(List.of());
    }

    @Inject
    public LoaderRegistry(Instance<FormatLoaderFactory> factories) {
        this(factories.stream().toList());
    }

    public LoaderRegistry(List<FormatLoaderFactory> factories) {
        this.factories = List.copyOf(factories);
    }

    /**
     * Finds the highest-priority factory whose criteria match the context.
     */
    public Optional<FormatLoaderFactory> findFactory(FileContext context) {
        String contentType = context.contentType().orElse(null);
        String filename = context.filename();

        return factories.stream()
                .filter(f -> f.getDetectionCriteria().matches(contentType, filename))
                .max(Comparator.comparingInt(f -> f.getDetectionCriteria().priority()));
    }

    @Override
    public DocumentLoader create(String filename, String contentType, Path path) {
        FileContext context = FileContext.of(filename, contentType, path);
        return findFactory(context)
                .map(f -> f.createLoader(context))
                .orElseThrow(() -> new UnsupportedFormatException(filename, contentType));
    }
}
