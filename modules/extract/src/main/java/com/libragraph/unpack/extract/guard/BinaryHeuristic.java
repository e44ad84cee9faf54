package com.libragraph.unpack.extract.guard;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Cheap, format-agnostic check for whether a file looks like text.
 *
 * <p>Samples the first {@value #SAMPLE_SIZE} bytes. A NUL byte, or fewer than
 * 70% printable ASCII / tab / LF / CR bytes, means binary. An empty file is text.
 * Unreadable files are reported as binary.
 */
public final class BinaryHeuristic {

    private static final Logger log = Logger.getLogger(BinaryHeuristic.class);

    public static final int SAMPLE_SIZE = 8192;
    public static final double MIN_TEXT_RATIO = 0.70;

    private BinaryHeuristic() {
    }

    public static boolean isBinary(Path file) {
        byte[] sample;
        try (InputStream in = Files.newInputStream(file)) {
            sample = in.readNBytes(SAMPLE_SIZE);
        } catch (IOException e) {
            log.debugf(e, "Cannot sample %s, treating as binary", file);
            return true;
        }
        return isBinary(sample);
    }

    public static boolean isBinary(byte[] sample) {
        if (sample.length == 0) {
            return false;
        }
        int textual = 0;
        for (byte b : sample) {
            if (b == 0) {
                return true;
            }
            if (isTextByte(b)) {
                textual++;
            }
        }
        return (double) textual / sample.length < MIN_TEXT_RATIO;
    }

    private static boolean isTextByte(byte b) {
        return (b >= 32 && b <= 126) || b == '\t' || b == '\n' || b == '\r';
    }
}
