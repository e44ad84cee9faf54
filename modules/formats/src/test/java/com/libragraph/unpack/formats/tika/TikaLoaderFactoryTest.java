package com.libragraph.unpack.formats.tika;

import com.libragraph.unpack.formats.api.FileContext;
import com.libragraph.unpack.types.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TikaLoaderFactoryTest {

    private final TikaLoaderFactory factory = new TikaLoaderFactory();

    @TempDir
    Path tempDir;

    @Test
    void shouldBeCatchAllWithLowestPriority() {
        var criteria = factory.getDetectionCriteria();

        assertThat(criteria.matches("application/octet-stream", "blob.bin")).isTrue();
        assertThat(criteria.priority()).isEqualTo(0);
    }

    @Test
    void shouldExtractTextFromHtml() throws Exception {
        Path file = tempDir.resolve("page.html");
        Files.writeString(file, "<html><head><title>Greeting</title></head>"
                + "<body><p>Hello from Tika</p></body></html>");

        List<Document> docs = factory.createLoader(FileContext.of(file)).load();

        assertThat(docs).hasSize(1);
        assertThat(docs.get(0).text()).contains("Hello from Tika");
        assertThat(docs.get(0).metadata())
                .containsEntry("filename", "page.html")
                .containsKey("format")
                .doesNotContainKey("source");
    }

    @Test
    void shouldCopyDocumentTitle() throws Exception {
        Path file = tempDir.resolve("titled.html");
        Files.writeString(file, "<html><head><title>Quarterly Report</title></head>"
                + "<body><p>Numbers went up.</p></body></html>");

        List<Document> docs = factory.createLoader(FileContext.of(file)).load();

        assertThat(docs).hasSize(1);
        assertThat(docs.get(0).metadata()).containsEntry("dc:title", "Quarterly Report");
    }
}
