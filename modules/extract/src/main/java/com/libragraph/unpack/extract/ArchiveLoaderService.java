package com.libragraph.unpack.extract;

import com.libragraph.unpack.extract.config.ExtractionConfig;
import com.libragraph.unpack.extract.config.SkipRuleset;
import com.libragraph.unpack.extract.zip.ZipExtractionJob;
import com.libragraph.unpack.formats.api.DocumentLoaderFactory;
import com.libragraph.unpack.types.Document;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for loading documents out of an uploaded archive.
 *
 * <p>Every call runs an independent {@link ZipExtractionJob} with limits read
 * from {@link ExtractionConfig} at call time, so concurrent calls never share
 * a scratch area or quota.
 */
@ApplicationScoped
public class ArchiveLoaderService {

    private static final Logger log = Logger.getLogger(ArchiveLoaderService.class);

    private final ExtractionConfig config;
    private final DocumentLoaderFactory loaderFactory;

    protected ArchiveLoaderService() {
        this.config = null;
        this.loaderFactory = null;
    }

    @Inject
    public ArchiveLoaderService(ExtractionConfig config, DocumentLoaderFactory loaderFactory) {
        this.config = config;
        this.loaderFactory = loaderFactory;
    }

    /**
     * Loads documents using the configured skip prefixes.
     *
     * @param archive     readable ZIP file
     * @param archiveName display name stamped onto every document
     * @param contentType caller-supplied type of the archive itself; informational only
     */
    public List<Document> load(Path archive, String archiveName, String contentType) {
        return extract(archive, archiveName, contentType, config.skipRules()).documents();
    }

    public List<Document> load(Path archive, String archiveName, String contentType,
                               SkipRuleset skipRules) {
        return extract(archive, archiveName, contentType, skipRules).documents();
    }

    /**
     * Same as {@link #load(Path, String, String, SkipRuleset)} but also returns job counters.
     */
    public ExtractionResult extract(Path archive, String archiveName, String contentType,
                                    SkipRuleset skipRules) {
        log.debugf("Extracting %s (%s)", archiveName, contentType);
        ZipExtractionJob job = new ZipExtractionJob(config.limits(), skipRules, loaderFactory);
        return job.run(archive, archiveName);
    }
}
