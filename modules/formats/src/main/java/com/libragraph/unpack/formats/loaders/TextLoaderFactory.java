package com.libragraph.unpack.formats.loaders;

import com.libragraph.unpack.formats.api.*;
import com.libragraph.unpack.types.Document;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loader for plain text, data and source files.
 * Priority 100 (higher than Tika's 0).
 *
 * <p>Bytes are decoded as UTF-8 with malformed sequences replaced, so files in
 * a legacy encoding still yield a document instead of an error.
 */
@ApplicationScoped
public class TextLoaderFactory implements FormatLoaderFactory {

    private static final char BOM = '\uFEFF';

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(
                // No "text/*": markup such as HTML is left to Tika
                Set.of("text/plain", "text/csv", "text/tab-separated-values",
                        "text/markdown", "text/x-web-markdown", "text/x-log",
                        "text/x-java-source", "text/x-python", "text/javascript",
                        "application/json", "application/xml", "application/javascript",
                        "application/x-sh", "application/x-yaml"),
                Set.of("txt", "md", "markdown", "rst", "log", "text", "csv", "tsv",
                        "json", "yaml", "yml", "toml", "ini", "cfg", "conf", "properties",
                        "xml", "java", "kt", "py", "js", "ts", "go", "rs", "c", "h", "cpp",
                        "rb", "sh", "sql"),
                100
        );
    }

    @Override
    public DocumentLoader createLoader(FileContext context) {
        return new TextLoader(context);
    }

    private static class TextLoader implements DocumentLoader {
        private final FileContext context;

        TextLoader(FileContext context) {
            this.context = context;
        }

        @Override
        public List<Document> load() throws IOException {
            byte[] bytes = Files.readAllBytes(context.path());
            String text = new String(bytes, StandardCharsets.UTF_8);
            if (!text.isEmpty() && text.charAt(0) == BOM) {
                text = text.substring(1);
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("filename", context.filename());
            metadata.put("format", context.contentType().orElse("text/plain"));
            metadata.put("size", (long) bytes.length);
            metadata.put("lines", text.isEmpty() ? 0L : text.lines().count());

            return List.of(new Document(text, metadata));
        }
    }
}
