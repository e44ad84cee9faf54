package com.libragraph.unpack.extract.zip;

import com.libragraph.unpack.extract.ArchiveExtractionException;
import com.libragraph.unpack.extract.guard.PathSanitizer;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;

/**
 * Job-private temporary directory that extracted members are written to.
 *
 * <p>{@link #close()} removes the directory and everything below it. Use it
 * in try-with-resources so removal happens on every exit path.
 */
public class ScratchArea implements AutoCloseable {

    private static final Logger log = Logger.getLogger(ScratchArea.class);

    private final Path root;
    private boolean closed;

    private ScratchArea(Path root) {
        this.root = root;
    }

    /**
     * Creates a fresh scratch directory.
     *
     * @param parent directory to create it in, or null for the system temp directory
     */
    public static ScratchArea create(Path parent) {
        try {
            Path dir = parent == null
                    ? Files.createTempDirectory("unpack-")
                    : Files.createTempDirectory(parent, "unpack-");
            return new ScratchArea(dir.toRealPath());
        } catch (IOException e) {
            throw new ArchiveExtractionException("Failed to create scratch area", e);
        }
    }

    public Path root() {
        return root;
    }

    /**
     * Resolves an archive member name to a confined destination under this area.
     */
    public Optional<Path> resolve(String rawName) {
        return PathSanitizer.resolve(root, rawName);
    }

    /**
     * Whether an earlier member already claimed {@code destination} or one of its
     * parent directories with the other kind of entry: a directory where a file is
     * wanted, or a file where a directory is needed.
     *
     * @param destination a path returned by {@link #resolve(String)}
     */
    public boolean collides(Path destination) {
        if (Files.isDirectory(destination, LinkOption.NOFOLLOW_LINKS)) {
            return true;
        }
        for (Path dir = destination.getParent(); dir != null && !dir.equals(root); dir = dir.getParent()) {
            if (Files.exists(dir, LinkOption.NOFOLLOW_LINKS)
                    && !Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
                return true;
            }
        }
        return false;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!Files.exists(root)) {
            return;
        }
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                        throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc)
                        throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            // Must not mask the job's own result or failure
            log.warnf(e, "Failed to remove scratch area %s", root);
        }
    }
}
