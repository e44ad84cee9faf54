package com.libragraph.unpack.extract.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.List;
import java.util.Optional;

/**
 * Process-wide extraction settings.
 *
 * <p>Each property can also be supplied as an environment variable, e.g.
 * {@code UNPACK_ARCHIVE_MAX_FILES}. Values are copied into immutable
 * {@link ExtractionLimits} / {@link SkipRuleset} once per job.
 */
@ApplicationScoped
public class ExtractionConfig {

    @ConfigProperty(name = "unpack.archive.max-files", defaultValue = "2000")
    int maxFiles = ExtractionLimits.DEFAULT_MAX_FILES;

    @ConfigProperty(name = "unpack.archive.max-total-bytes", defaultValue = "104857600")
    long maxTotalBytes = ExtractionLimits.DEFAULT_MAX_TOTAL_BYTES;

    @ConfigProperty(name = "unpack.archive.max-file-bytes", defaultValue = "10485760")
    long maxFileBytes = ExtractionLimits.DEFAULT_MAX_FILE_BYTES;

    /** Replaces the built-in skip prefixes when set. */
    @ConfigProperty(name = "unpack.archive.skip-prefixes")
    Optional<List<String>> skipPrefixes = Optional.empty();

    public ExtractionLimits limits() {
        return new ExtractionLimits(maxFiles, maxTotalBytes, maxFileBytes);
    }

    public SkipRuleset skipRules() {
        return skipPrefixes
                .filter(prefixes -> !prefixes.isEmpty())
                .map(SkipRuleset::of)
                .orElseGet(SkipRuleset::defaults);
    }
}
