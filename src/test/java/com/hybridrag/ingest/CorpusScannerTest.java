package com.hybridrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorpusScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSplitDocsAndCodeAndHonourExcludes() throws IOException {
        write("README.md");
        write("docs/guide.md");
        write("src/App.java");
        write("web/app.js");
        write("node_modules/lib/index.js");
        write("target/generated/Gen.java");
        write("notes.txt");

        CorpusScanner scanner = new CorpusScanner(tempDir,
                List.of("**/*.md"),
                List.of("**/*.java", "**/*.js"),
                List.of("**/node_modules/**", "**/target/**"));
        CorpusScanner.Corpus corpus = scanner.scan();

        assertEquals(List.of("README.md", "docs/guide.md"), corpus.docs());
        assertEquals(List.of("src/App.java", "web/app.js"), corpus.code());
        assertEquals(4, corpus.all().size());
    }

    @Test
    void shouldRelativizeWithForwardSlashes() {
        CorpusScanner scanner = new CorpusScanner(tempDir, List.of(), List.of(), null);

        assertEquals("docs/guide.md", scanner.relativize(tempDir.resolve("docs").resolve("guide.md")));
        assertEquals(tempDir.resolve("docs/guide.md"), scanner.resolve("docs/guide.md"));
    }

    private void write(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "content of " + relative + "\n");
    }
}
