package com.libragraph.unpack.formats.registry;

import com.libragraph.unpack.formats.api.*;
import com.libragraph.unpack.formats.loaders.TextLoaderFactory;
import com.libragraph.unpack.formats.tika.TikaLoaderFactory;
import com.libragraph.unpack.types.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LoaderRegistryTest {

    private final TextLoaderFactory text = new TextLoaderFactory();
    private final TikaLoaderFactory tika = new TikaLoaderFactory();
    private final LoaderRegistry registry = new LoaderRegistry(List.of(tika, text));

    @TempDir
    Path tempDir;

    @Test
    void shouldPreferHigherPriorityFactory() {
        FileContext context = FileContext.of("notes.txt", "text/plain", tempDir.resolve("notes.txt"));

        assertThat(registry.findFactory(context)).containsSame(text);
    }

    @Test
    void shouldFallBackToCatchAll() {
        FileContext context = FileContext.of("report.pdf", "application/pdf", tempDir.resolve("report.pdf"));

        assertThat(registry.findFactory(context)).containsSame(tika);
    }

    @Test
    void shouldSendMarkupToTika() {
        FileContext context = FileContext.of("page.html", "text/html", tempDir.resolve("page.html"));

        assertThat(registry.findFactory(context)).containsSame(tika);
    }

    @Test
    void shouldTreatBlankHintAsUnknown() {
        FileContext context = FileContext.of("README.md", "", tempDir.resolve("README.md"));

        assertThat(context.contentType()).isEmpty();
        assertThat(registry.findFactory(context)).containsSame(text);
    }

    @Test
    void shouldCreateWorkingLoader() throws Exception {
        Path file = tempDir.resolve("notes.txt");
        Files.writeString(file, "hello world");

        List<Document> docs = registry.create("notes.txt", "text/plain", file).load();

        assertThat(docs).extracting(Document::text).containsExactly("hello world");
    }

    @Test
    void shouldRejectWhenNothingMatches() {
        LoaderRegistry textOnly = new LoaderRegistry(List.of(text));

        assertThatThrownBy(() -> textOnly.create("photo.png", "image/png", tempDir.resolve("photo.png")))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessageContaining("photo.png");
    }
}
