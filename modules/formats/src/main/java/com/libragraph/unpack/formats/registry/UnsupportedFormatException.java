package com.libragraph.unpack.formats.registry;

/**
 * Thrown when no registered loader factory accepts a file.
 */
public class UnsupportedFormatException extends RuntimeException {

    public UnsupportedFormatException(String filename, String contentType) {
        super("No loader for " + filename
                + (contentType == null || contentType.isEmpty() ? "" : " (" + contentType + ")"));
    }
}
