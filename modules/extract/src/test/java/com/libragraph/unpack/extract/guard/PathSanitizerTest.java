package com.libragraph.unpack.extract.guard;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class PathSanitizerTest {

    @TempDir
    Path root;

    @ParameterizedTest
    @ValueSource(strings = {
            "../evil.txt",
            "a/../../evil.txt",
            "a/b/../../../evil.txt",
            "..\\evil.txt",
            "a\\..\\..\\evil.txt",
            "/etc/passwd",
            "\\windows\\system32\\evil.dll",
            "C:/Windows/evil.txt",
            "c:\\evil.txt",
            "z:/evil.txt",
            "..",
            ".",
            "a/..",
            ""
    })
    void shouldRejectEscapingOrDegenerateNames(String name) {
        assertThat(PathSanitizer.resolve(root, name)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "notes.txt",
            "docs/readme.md",
            "docs\\windows\\style.txt",
            "a/../b.txt",
            "./c.txt",
            "deep/nested/dir/file.java",
            "C:notes.txt"
    })
    void shouldAcceptNamesConfinedToRoot(String name) throws Exception {
        Optional<Path> resolved = PathSanitizer.resolve(root, name);

        Path canonicalRoot = root.toRealPath();
        assertThat(resolved).isPresent();
        assertThat(resolved.get()).startsWithRaw(canonicalRoot);
        assertThat(resolved.get()).isNotEqualTo(canonicalRoot);
    }

    @Test
    void shouldNormalizeSeparators() throws Exception {
        Optional<Path> resolved = PathSanitizer.resolve(root, "docs\\sub\\file.txt");

        assertThat(resolved).contains(root.toRealPath().resolve("docs/sub/file.txt"));
        assertThat(PathSanitizer.normalize("a\\b\\c")).isEqualTo("a/b/c");
    }

    @Test
    void shouldNotTreatSiblingWithSharedPrefixAsInside() throws Exception {
        // "<root>-evil" shares a string prefix with "<root>" but is not below it
        String sibling = "../" + root.getFileName() + "-evil/x.txt";

        assertThat(PathSanitizer.resolve(root, sibling)).isEmpty();
    }

    @Test
    void shouldRejectTraversalThroughSymlinkedDirectory() throws Exception {
        Path outside = Files.createTempDirectory("outside-");
        try {
            Files.createSymbolicLink(root.resolve("link"), outside);

            assertThat(PathSanitizer.resolve(root, "link/escaped.txt")).isEmpty();
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    @Test
    void shouldRejectNullAndInvalidNames() {
        assertThat(PathSanitizer.resolve(root, null)).isEmpty();
        assertThat(PathSanitizer.resolve(root, "bad\u0000name.txt")).isEmpty();
    }

    @Test
    void shouldNotCreateAnything() throws Exception {
        PathSanitizer.resolve(root, "new/dir/file.txt");

        try (var children = Files.list(root)) {
            assertThat(children).isEmpty();
        }
    }
}
