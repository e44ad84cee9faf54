package com.libragraph.unpack.extract.zip;

import com.libragraph.unpack.extract.ArchiveExtractionException;
import com.libragraph.unpack.extract.ContentTypeGuesser;
import com.libragraph.unpack.extract.ExtractionResult;
import com.libragraph.unpack.extract.MetadataEnricher;
import com.libragraph.unpack.extract.config.ExtractionLimits;
import com.libragraph.unpack.extract.config.SkipRuleset;
import com.libragraph.unpack.extract.guard.BinaryHeuristic;
import com.libragraph.unpack.extract.guard.QuotaTracker;
import com.libragraph.unpack.formats.api.DocumentLoader;
import com.libragraph.unpack.formats.api.DocumentLoaderFactory;
import com.libragraph.unpack.types.Document;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Extracts a ZIP archive into a scratch area and loads each eligible member.
 *
 * <p>Members are handled one at a time, in central-directory order:
 * skip rules, path confinement, name collisions, size quota, bounded write, binary check,
 * then the injected loader. Rejected members are dropped silently; a loader
 * failure drops only that member. Exhausting the size budget stops the job
 * and returns what was loaded so far. Failing to open the archive or to write
 * into the scratch area raises {@link ArchiveExtractionException}.
 *
 * <p>A job holds no state between runs and may be reused sequentially.
 */
public class ZipExtractionJob {

    private static final Logger log = Logger.getLogger(ZipExtractionJob.class);

    static final String ARCHIVE_EXTENSION = ".zip";
    private static final int COPY_BUFFER_SIZE = 8192;

    private final ExtractionLimits limits;
    private final SkipRuleset skipRules;
    private final DocumentLoaderFactory loaderFactory;
    private final Path scratchParent;

    public ZipExtractionJob(ExtractionLimits limits, SkipRuleset skipRules,
                            DocumentLoaderFactory loaderFactory) {
        this(limits, skipRules, loaderFactory, null);
    }

    /**
     * @param scratchParent where to create the scratch area, or null for the system temp directory
     */
    public ZipExtractionJob(ExtractionLimits limits, SkipRuleset skipRules,
                            DocumentLoaderFactory loaderFactory, Path scratchParent) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.skipRules = Objects.requireNonNull(skipRules, "skipRules");
        this.loaderFactory = Objects.requireNonNull(loaderFactory, "loaderFactory");
        this.scratchParent = scratchParent;
    }

    public ExtractionResult run(Path archive, String archiveName) {
        try (ScratchArea scratch = ScratchArea.create(scratchParent);
             ZipFile zipFile = ZipFile.builder().setFile(archive.toFile()).get()) {
            return extract(zipFile, scratch, archiveName);
        } catch (IOException e) {
            throw new ArchiveExtractionException("Failed to extract archive: " + archiveName, e);
        }
    }

    private ExtractionResult extract(ZipFile zipFile, ScratchArea scratch, String archiveName)
            throws IOException {
        List<ZipArchiveEntry> members = listMembers(zipFile);
        int listed = members.size();
        if (listed > limits.maxFiles()) {
            log.debugf("Archive %s has %d members, only the first %d are visited",
                    archiveName, listed, limits.maxFiles());
            members = members.subList(0, limits.maxFiles());
        }

        QuotaTracker quota = new QuotaTracker(limits);
        List<Document> documents = new ArrayList<>();
        int visited = 0;
        int delegated = 0;

        for (ZipArchiveEntry entry : members) {
            visited++;
            ArchiveMember member = ArchiveMember.of(entry);

            if (skipRules.matches(member.name())) {
                log.debugf("Skipping %s: matches a skip prefix", member.name());
                continue;
            }
            if (ARCHIVE_EXTENSION.equals(member.extension())) {
                log.debugf("Skipping %s: nested archive", member.name());
                continue;
            }
            if (!zipFile.canReadEntryData(entry)) {
                log.debugf("Skipping %s: unsupported encryption or compression method", member.name());
                continue;
            }

            Optional<Path> destination = scratch.resolve(member.rawName());
            if (destination.isEmpty()) {
                log.debugf("Skipping %s: path escapes the extraction root", member.rawName());
                continue;
            }
            if (scratch.collides(destination.get())) {
                log.debugf("Skipping %s: collides with an earlier file or directory", member.name());
                continue;
            }

            QuotaTracker.Verdict verdict = quota.tryAccept(member.declaredSize());
            if (verdict == QuotaTracker.Verdict.EXHAUSTED) {
                log.infof("Archive %s exceeds %d bytes at %s; remaining members abandoned",
                        archiveName, limits.maxTotalBytes(), member.name());
                break;
            }
            if (verdict == QuotaTracker.Verdict.MEMBER_TOO_LARGE) {
                log.debugf("Skipping %s: declared size %d exceeds %d bytes",
                        member.name(), member.declaredSize(), limits.maxFileBytes());
                continue;
            }

            Path file = destination.get();
            if (!write(zipFile, entry, file, quota.chargeFor(member.declaredSize()))) {
                log.debugf("Skipping %s: decompressed past its declared size", member.name());
                continue;
            }
            if (BinaryHeuristic.isBinary(file)) {
                log.debugf("Skipping %s: binary content", member.name());
                continue;
            }

            Optional<List<Document>> loaded = delegate(member, file, archiveName);
            if (loaded.isPresent()) {
                delegated++;
                documents.addAll(loaded.get());
            }
        }

        log.infof("Extracted %s: %d of %d members loaded, %d documents%s",
                archiveName, delegated, listed, documents.size(),
                quota.isExhausted() ? " (size budget exhausted)" : "");
        return new ExtractionResult(documents, listed, visited, delegated, quota.isExhausted());
    }

    private static List<ZipArchiveEntry> listMembers(ZipFile zipFile) {
        List<ZipArchiveEntry> members = new ArrayList<>();
        for (ZipArchiveEntry entry : Collections.list(zipFile.getEntries())) {
            if (!entry.isDirectory()) {
                members.add(entry);
            }
        }
        return members;
    }

    /**
     * Streams a member to disk, refusing to write more than {@code maxBytes}.
     *
     * @return false if the member produced more bytes than allowed; the partial file is removed
     */
    private static boolean write(ZipFile zipFile, ZipArchiveEntry entry, Path file, long maxBytes)
            throws IOException {
        Files.createDirectories(file.getParent());

        long written = 0;
        boolean overflow = false;
        try (InputStream in = zipFile.getInputStream(entry);
             OutputStream out = Files.newOutputStream(file)) {
            byte[] buffer = new byte[COPY_BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                written += read;
                if (written > maxBytes) {
                    overflow = true;
                    break;
                }
                out.write(buffer, 0, read);
            }
        }

        if (overflow) {
            Files.deleteIfExists(file);
            return false;
        }
        return true;
    }

    private Optional<List<Document>> delegate(ArchiveMember member, Path file, String archiveName) {
        String filename = member.baseName();
        String contentType = ContentTypeGuesser.guess(filename);
        try {
            DocumentLoader loader = loaderFactory.create(filename, contentType, file);
            List<Document> loaded = loader.load();
            if (loaded == null) {
                loaded = List.of();
            }
            return Optional.of(MetadataEnricher.enrichAll(loaded, archiveName, member.name()));
        } catch (Exception e) {
            log.warnf(e, "Loader failed for %s in %s; no documents produced", member.name(), archiveName);
            return Optional.empty();
        }
    }
}
