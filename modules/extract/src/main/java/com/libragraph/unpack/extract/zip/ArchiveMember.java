package com.libragraph.unpack.extract.zip;

import com.libragraph.unpack.extract.guard.PathSanitizer;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;

import java.util.Locale;

/**
 * Identity of one archive entry as the archive declares it.
 * Neither the name nor the size is trusted without checking.
 *
 * @param rawName      name exactly as stored in the archive
 * @param name         {@code rawName} with {@code /} separators
 * @param declaredSize declared uncompressed size, negative when unknown
 * @param directory    true for directory entries
 */
public record ArchiveMember(
        String rawName,
        String name,
        long declaredSize,
        boolean directory
) {
    public static ArchiveMember of(ZipArchiveEntry entry) {
        return new ArchiveMember(
                entry.getName(),
                PathSanitizer.normalize(entry.getName()),
                entry.getSize(),
                entry.isDirectory()
        );
    }

    /** Last path segment, e.g. {@code notes.txt} for {@code docs/notes.txt}. */
    public String baseName() {
        return name.substring(name.lastIndexOf('/') + 1);
    }

    /** Lower-case extension including the dot, or empty. */
    public String extension() {
        String base = baseName();
        int dot = base.lastIndexOf('.');
        return dot < 0 ? "" : base.substring(dot).toLowerCase(Locale.ROOT);
    }
}
