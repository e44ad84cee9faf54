package com.libragraph.unpack.extract;

/**
 * Wraps I/O failures that make a whole extraction job untrustworthy:
 * the archive cannot be opened or read, or the scratch area cannot be written.
 */
public class ArchiveExtractionException extends RuntimeException {

    public ArchiveExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
