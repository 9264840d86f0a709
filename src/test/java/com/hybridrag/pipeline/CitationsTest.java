package com.hybridrag.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.hybridrag.store.BackendRole;
import com.hybridrag.store.SearchResult;

class CitationsTest {

    @Test
    void shouldFormatWithForwardSlashes() {
        assertEquals("docs/a.md (line 7)", Citations.format("docs\\a.md", 7));
    }

    @Test
    void shouldCiteEachFileOnceAmongTopResults() {
        List<SearchResult> results = List.of(
                result("a.md", 1), result("a.md", 9), result("b.md", 2),
                result("c.md", 3), result("d.md", 4), result("e.md", 5));

        assertEquals(List.of("a.md (line 1)", "b.md (line 2)", "c.md (line 3)", "d.md (line 4)"),
                Citations.sources(results));
    }

    private static SearchResult result(String path, int line) {
        return new SearchResult(line, "x", path, line, 1f, BackendRole.PRIMARY, Map.of());
    }
}
