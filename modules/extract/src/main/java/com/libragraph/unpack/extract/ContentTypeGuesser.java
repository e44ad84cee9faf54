package com.libragraph.unpack.extract;

import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;
import org.apache.tika.mime.MimeTypes;
import org.jboss.logging.Logger;

import java.io.IOException;

/**
 * Guesses a MIME type from a file name alone (no content sniffing).
 * Returns an empty string when Tika has no better answer than octet-stream.
 */
public final class ContentTypeGuesser {

    private static final Logger log = Logger.getLogger(ContentTypeGuesser.class);
    private static final MimeTypes MIME_TYPES = MimeTypes.getDefaultMimeTypes();

    private ContentTypeGuesser() {
    }

    public static String guess(String filename) {
        if (filename == null || filename.isEmpty()) {
            return "";
        }
        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
        try {
            MediaType type = MIME_TYPES.detect(null, metadata);
            return MediaType.OCTET_STREAM.equals(type) ? "" : type.toString();
        } catch (IOException e) {
            log.debugf(e, "No content type for %s", filename);
            return "";
        }
    }
}
