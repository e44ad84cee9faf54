package com.libragraph.unpack.extract.guard;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Confines archive member names to an extraction root (zip-slip protection).
 *
 * <p>Never throws for a hostile name: any name that is absolute, drive-qualified,
 * syntactically invalid, or that canonicalizes to the root itself or outside of
 * it is rejected with {@link Optional#empty()}.
 */
public final class PathSanitizer {

    private static final Pattern DRIVE_QUALIFIED = Pattern.compile("^[A-Za-z]:/");

    private PathSanitizer() {
    }

    /**
     * Rewrites Windows separators to {@code /}.
     */
    public static String normalize(String rawName) {
        return rawName.replace('\\', '/');
    }

    /**
     * Resolves {@code rawName} under {@code root}.
     *
     * @param root    extraction root; canonicalized before comparison
     * @param rawName member name exactly as declared in the archive
     * @return canonical destination strictly below the canonical root, or empty
     */
    public static Optional<Path> resolve(Path root, String rawName) {
        if (rawName == null) {
            return Optional.empty();
        }
        String name = normalize(rawName);
        if (name.isEmpty() || name.startsWith("/") || DRIVE_QUALIFIED.matcher(name).find()) {
            return Optional.empty();
        }

        try {
            Path canonicalRoot = root.toFile().getCanonicalFile().toPath();
            Path destination = canonicalRoot.resolve(name).toFile().getCanonicalFile().toPath();
            if (!destination.startsWith(canonicalRoot) || destination.equals(canonicalRoot)) {
                return Optional.empty();
            }
            return Optional.of(destination);
        } catch (IOException | InvalidPathException e) {
            return Optional.empty();
        }
    }
}
