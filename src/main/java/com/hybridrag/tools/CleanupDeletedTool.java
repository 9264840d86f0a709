package com.hybridrag.tools;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;

import com.hybridrag.ingest.CorpusScanner;
import com.hybridrag.store.BackendRole;
import com.hybridrag.store.HybridPointStore;

class CleanupDeletedTool extends AbstractTool {
    private final HybridPointStore store;
    private final CorpusScanner scanner;

    CleanupDeletedTool(HybridPointStore store, CorpusScanner scanner) {
        super("cleanup_deleted", "Count chunks of files that no longer exist in the project; soft-delete them when dry_run is false.");
        this.store = store;
        this.scanner = scanner;
    }

    @Override
    Object execute(ToolArguments arguments) {
        BackendRole target = arguments.role("collection", BackendRole.PRIMARY);
        boolean dryRun = arguments.bool("dry_run", true);
        CorpusScanner.Corpus corpus;
        try {
            corpus = scanner.scan();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan project root: " + e.getMessage(), e);
        }
        int count = store.cleanupDeletedFiles(new HashSet<>(corpus.all()), target, dryRun);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("collection", target.label());
        out.put("dry_run", dryRun);
        out.put(dryRun ? "would_mark_deleted" : "marked_deleted", count);
        return out;
    }
}
