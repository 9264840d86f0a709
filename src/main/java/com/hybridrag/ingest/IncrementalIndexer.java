package com.hybridrag.ingest;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.error.RagException;
import com.hybridrag.store.BackendRole;
import com.hybridrag.store.Chunk;
import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.PayloadFields;
import com.hybridrag.store.Point;
import com.hybridrag.store.PointFilter;
import com.hybridrag.store.PointStoreBackend;

/**
 * Re-indexes a single file against one backend by writing only the chunks that changed.
 */
public class IncrementalIndexer {
    private static final Logger log = LoggerFactory.getLogger(IncrementalIndexer.class);

    private final HybridPointStore store;

    public IncrementalIndexer(HybridPointStore store) {
        this.store = store;
    }

    public boolean indexFile(String filePath, BackendRole target, List<Chunk> chunks) {
        String normalized = PayloadFields.normalizePath(filePath);
        PointStoreBackend backend = store.backend(target);
        if (!backend.isEnabled()) {
            log.debug("Skipping {} for disabled {} backend", normalized, target.label());
            return true;
        }
        try {
            List<Point> existing = store.scanAll(target, PointFilter.fileEquals(normalized));
            List<Chunk> anchored = chunks.stream()
                    .map(chunk -> normalized.equals(chunk.filePath()) ? chunk : chunk.withFilePath(normalized))
                    .toList();
            ChunkDiff diff = ChunkDiffer.diff(existing, anchored);
            if (!diff.hasChanges()) {
                log.info("{} [{}]: {} chunks unchanged", normalized, target.label(), diff.unchanged());
                return true;
            }

            List<Point> writes = new ArrayList<>();
            int skipped = 0;
            for (List<Chunk> group : List.of(diff.toAdd(), diff.toUpdate())) {
                for (Chunk chunk : group) {
                    try {
                        writes.add(store.pointFor(chunk));
                    } catch (RagException e) {
                        skipped++;
                        log.warn("Skipping chunk {}:{}: {}", normalized, chunk.lineStart(), e.getMessage());
                    }
                }
            }
            if (!writes.isEmpty()) {
                backend.upsert(writes);
            }
            if (!diff.toDelete().isEmpty()) {
                backend.delete(diff.toDelete());
            }
            log.info("{} [{}]: added={} updated={} deleted={} unchanged={} skipped={}", normalized, target.label(),
                    diff.toAdd().size(), diff.toUpdate().size(), diff.toDelete().size(), diff.unchanged(), skipped);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to index {} into {}", normalized, target.label(), e);
            return false;
        }
    }
}
