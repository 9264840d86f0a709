package com.hybridrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

import com.hybridrag.embedding.ContentCategory;
import com.hybridrag.store.Chunk;
import com.hybridrag.store.ContentType;

class CodeChunkerTest {

    @Test
    void shouldWindowLinesWithOverlap() {
        String source = IntStream.rangeClosed(1, 10).mapToObj(i -> "x = " + i).collect(Collectors.joining("\n"));

        List<Chunk> chunks = new CodeChunker(4, 1).chunk("src/calc.py", source);

        assertEquals(List.of(1, 4, 7), chunks.stream().map(Chunk::lineStart).toList());
        assertEquals(List.of(4, 7, 10), chunks.stream().map(Chunk::lineEnd).toList());
        assertTrue(chunks.stream().allMatch(chunk -> chunk.contentType() == ContentType.CODE));
        assertEquals(ContentCategory.CODE, chunks.get(0).category());
    }

    @Test
    void shouldTagLanguageDeclarationAndImports() {
        String source = "import os\nfrom pathlib import Path\n\ndef handler(event):\n    return os.getcwd()\n";

        Chunk chunk = new CodeChunker(80, 12).chunk("lambda/handler.py", source).get(0);

        assertEquals("python", chunk.language());
        assertEquals("function", chunk.codeType());
        assertEquals("handler", chunk.metadata().get("name"));
        assertEquals(List.of("import os", "from pathlib import Path"), chunk.metadata().get("imports"));
    }

    @Test
    void shouldUseFirstDeclarationKeyword() {
        Chunk chunk = new CodeChunker(80, 12)
                .chunk("src/Foo.java", "public class Foo {\n    void go() {}\n}").get(0);

        assertEquals("java", chunk.language());
        assertEquals("class", chunk.codeType());
        assertEquals("Foo", chunk.metadata().get("name"));
        assertFalse(chunk.metadata().containsKey("imports"));
    }

    @Test
    void shouldFallBackToBlockAndUnknownLanguage() {
        Chunk chunk = new CodeChunker(80, 12).chunk("scripts/run.zz", "echo hello").get(0);

        assertEquals("unknown", chunk.language());
        assertEquals("block", chunk.codeType());
        assertEquals("typescript", CodeChunker.languageOf("web/App.TSX"));
    }
}
