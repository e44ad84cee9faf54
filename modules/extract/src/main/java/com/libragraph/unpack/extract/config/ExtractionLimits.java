package com.libragraph.unpack.extract.config;

/**
 * Immutable resource ceilings for one extraction job.
 *
 * @param maxFiles      maximum number of non-directory members visited
 * @param maxTotalBytes ceiling on cumulative declared uncompressed bytes
 * @param maxFileBytes  ceiling on a single member's declared uncompressed bytes
 */
public record ExtractionLimits(
        int maxFiles,
        long maxTotalBytes,
        long maxFileBytes
) {
    public static final int DEFAULT_MAX_FILES = 2000;
    public static final long DEFAULT_MAX_TOTAL_BYTES = 100L * 1024 * 1024;
    public static final long DEFAULT_MAX_FILE_BYTES = 10L * 1024 * 1024;

    public ExtractionLimits {
        if (maxFiles <= 0) {
            throw new IllegalArgumentException("maxFiles must be positive: " + maxFiles);
        }
        if (maxTotalBytes <= 0) {
            throw new IllegalArgumentException("maxTotalBytes must be positive: " + maxTotalBytes);
        }
        if (maxFileBytes <= 0) {
            throw new IllegalArgumentException("maxFileBytes must be positive: " + maxFileBytes);
        }
    }

    public static ExtractionLimits defaults() {
        return new ExtractionLimits(DEFAULT_MAX_FILES, DEFAULT_MAX_TOTAL_BYTES, DEFAULT_MAX_FILE_BYTES);
    }
}
