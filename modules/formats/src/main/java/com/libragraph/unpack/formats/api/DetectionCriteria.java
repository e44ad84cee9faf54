package com.libragraph.unpack.formats.api;

import java.util.Locale;
import java.util.Set;

/**
 * Criteria for deciding when a loader factory should be used.
 *
 * @param mimeTypes  MIME types to match (e.g., "text/plain", "text/*")
 * @param extensions file extensions without dot (e.g., "txt", "md")
 * @param priority   higher priority wins on conflict (e.g., text=100 beats Tika=0)
 */
public record DetectionCriteria(
        Set<String> mimeTypes,
        Set<String> extensions,
        int priority
) {
    public DetectionCriteria {
        mimeTypes = Set.copyOf(mimeTypes);
        extensions = Set.copyOf(extensions);
    }

    /**
     * Creates criteria that match all files.
     * Used for the Tika fallback.
     */
    public static DetectionCriteria catchAll(int priority) {
        return new DetectionCriteria(Set.of("*/*"), Set.of("*"), priority);
    }

    /**
     * Checks if this criteria matches the given file properties.
     * Either argument may be null.
     */
    public boolean matches(String mimeType, String filename) {
        if (mimeTypes.contains("*/*")) {
            return true;
        }
        if (mimeType != null && !mimeType.isEmpty()) {
            if (mimeTypes.contains(mimeType)) {
                return true;
            }
            // Wildcards such as "text/*"
            String baseType = mimeType.split("/")[0];
            if (mimeTypes.contains(baseType + "/*")) {
                return true;
            }
        }

        if (extensions.contains("*")) {
            return true;
        }
        if (filename != null) {
            int dotIndex = filename.lastIndexOf('.');
            if (dotIndex > 0) {
                String ext = filename.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
                return extensions.contains(ext);
            }
        }

        return false;
    }
}
