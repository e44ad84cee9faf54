package com.libragraph.unpack.formats.tika;

import com.libragraph.unpack.formats.api.*;
import com.libragraph.unpack.types.Document;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.jboss.logging.Logger;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.*;

/**
 * Universal loader that uses Apache Tika.
 * Handles office documents, PDF, HTML, RTF and the other formats Tika can parse.
 *
 * <p>Priority: 0 (lowest) - dedicated loaders always take precedence.
 * Produces a single document, or none when the file carries no text.
 */
@ApplicationScoped
public class TikaLoaderFactory implements FormatLoaderFactory {

    private static final Logger log = Logger.getLogger(TikaLoaderFactory.class);

    /** Tika metadata keys copied onto the document. */
    private static final Set<String> KEPT_METADATA = Set.of(
            TikaCoreProperties.TITLE.getName(),
            TikaCoreProperties.CREATOR.getName(),
            TikaCoreProperties.CREATED.getName(),
            TikaCoreProperties.MODIFIED.getName(),
            TikaCoreProperties.LANGUAGE.getName(),
            "xmpTPg:NPages"
    );

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return DetectionCriteria.catchAll(0);
    }

    @Override
    public DocumentLoader createLoader(FileContext context) {
        return new TikaLoader(context, new AutoDetectParser());
    }

    private static class TikaLoader implements DocumentLoader {
        private final FileContext context;
        private final Parser parser;

        TikaLoader(FileContext context, Parser parser) {
            this.context = context;
            this.parser = parser;
        }

        @Override
        public List<Document> load() throws IOException {
            BodyContentHandler handler = new BodyContentHandler(-1);
            Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, context.filename());
            context.contentType().ifPresent(type -> metadata.set(Metadata.CONTENT_TYPE, type));

            try (InputStream stream = Files.newInputStream(context.path())) {
                parser.parse(stream, handler, metadata, new ParseContext());
            } catch (TikaException | SAXException e) {
                throw new IOException("Tika failed to parse " + context.filename(), e);
            }

            String text = handler.toString().trim();
            if (text.isEmpty()) {
                log.debugf("No text extracted from %s", context.filename());
                return List.of();
            }

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("filename", context.filename());
            String detected = metadata.get(Metadata.CONTENT_TYPE);
            result.put("format", detected != null ? detected : context.contentType().orElse(""));

            for (String name : metadata.names()) {
                if (!KEPT_METADATA.contains(name)) {
                    continue;
                }
                String[] values = metadata.getValues(name);
                if (values.length == 1) {
                    result.put(name, values[0]);
                } else if (values.length > 1) {
                    result.put(name, Arrays.asList(values));
                }
            }

            return List.of(new Document(text, result));
        }
    }
}
