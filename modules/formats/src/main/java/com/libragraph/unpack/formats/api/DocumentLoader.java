package com.libragraph.unpack.formats.api;

import com.libragraph.unpack.types.Document;

import java.io.IOException;
import java.util.List;

/**
 * Turns one file into zero or more documents.
 *
 * <p>A loader is bound to a single file when it is created and is used once.
 * Any failure (malformed content, unsupported sub-format, parser crash) is
 * reported by throwing; callers decide whether that aborts anything.
 */
public interface DocumentLoader {

    /**
     * Loads documents from the bound file.
     *
     * @return documents in the order the loader produced them, possibly empty
     * @throws IOException if the file cannot be read or parsed
     */
    List<Document> load() throws IOException;
}
