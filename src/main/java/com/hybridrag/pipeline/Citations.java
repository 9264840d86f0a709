package com.hybridrag.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.hybridrag.store.SearchResult;

public final class Citations {
    static final int MAX_SOURCES = 5;

    private Citations() {
    }

    public static String format(String filePath, int lineNumber) {
        String normalized = filePath == null ? "" : filePath.replace('\\', '/');
        return normalized + " (line " + lineNumber + ")";
    }

    /**
     * One citation per distinct file among the first {@value #MAX_SOURCES} results, in rank order.
     */
    public static List<String> sources(List<SearchResult> results) {
        Set<String> seenFiles = new LinkedHashSet<>();
        List<String> citations = new ArrayList<>();
        for (SearchResult result : results.subList(0, Math.min(MAX_SOURCES, results.size()))) {
            if (seenFiles.add(result.filePath())) {
                citations.add(format(result.filePath(), result.lineNumber()));
            }
        }
        return citations;
    }
}
