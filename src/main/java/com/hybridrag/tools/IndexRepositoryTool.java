package com.hybridrag.tools;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.hybridrag.error.ValidationException;
import com.hybridrag.ingest.IngestionReport;
import com.hybridrag.ingest.IngestionService;
import com.hybridrag.store.BackendRole;
import com.hybridrag.store.HybridPointStore;

class IndexRepositoryTool extends AbstractTool {
    private final IngestionService ingestion;
    private final HybridPointStore store;

    IndexRepositoryTool(IngestionService ingestion, HybridPointStore store) {
        super("index_repository", "Incrementally index documentation and/or code into cloud, local or both; prune soft-deletes removed files.");
        this.ingestion = ingestion;
        this.store = store;
    }

    @Override
    Object execute(ToolArguments arguments) {
        Set<BackendRole> targets = targets(arguments.string("target"));
        IngestionService.Scope scope = scope(arguments.string("scope"));
        boolean prune = arguments.bool("prune", false);
        IngestionReport report;
        try {
            report = ingestion.ingest(targets, scope, prune);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan project root: " + e.getMessage(), e);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("targets", targets.stream().map(BackendRole::label).toList());
        out.put("scope", scope.name().toLowerCase(Locale.ROOT));
        out.put("files_indexed", report.indexed());
        out.put("files_failed", report.failed());
        out.put("files_skipped", report.skipped());
        out.put("files_total", report.total());
        out.put("chunks", report.chunks());
        out.put("prune", report.pruned());
        out.put("stale_chunks", report.staleChunks());
        out.put("soft_deleted", report.softDeleted());
        return out;
    }

    private Set<BackendRole> targets(String raw) {
        String target = raw == null || raw.isBlank() ? "cloud" : raw.trim().toLowerCase(Locale.ROOT);
        Set<BackendRole> targets = target.equals("both")
                ? EnumSet.allOf(BackendRole.class)
                : EnumSet.of(BackendRole.fromLabel(target));
        if (targets.contains(BackendRole.SECONDARY) && !store.isEnabled(BackendRole.SECONDARY)) {
            throw new ValidationException("The local collection is disabled; use target=cloud");
        }
        return targets;
    }

    private static IngestionService.Scope scope(String raw) {
        if (raw == null || raw.isBlank()) {
            return IngestionService.Scope.ALL;
        }
        try {
            return IngestionService.Scope.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid scope: " + raw + ". Must be 'docs', 'code' or 'all'");
        }
    }
}
