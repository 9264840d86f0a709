package com.hybridrag.ingest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.store.Chunk;
import com.hybridrag.store.PayloadFields;
import com.hybridrag.store.Point;

/**
 * Compares the stored chunks of one file with a freshly chunked version, keyed by
 * start line. A soft-deleted stored chunk whose content reappears is scheduled for
 * update so that rewriting it clears the deletion flag.
 */
public final class ChunkDiffer {
    private static final Logger log = LoggerFactory.getLogger(ChunkDiffer.class);

    private ChunkDiffer() {
    }

    public static ChunkDiff diff(List<Point> existing, List<Chunk> incoming) {
        Map<Integer, Point> stored = new LinkedHashMap<>();
        for (Point point : existing) {
            stored.putIfAbsent(PayloadFields.integer(point.payload(), PayloadFields.LINE_START), point);
        }
        Map<Integer, Chunk> fresh = new LinkedHashMap<>();
        for (Chunk chunk : incoming) {
            if (fresh.putIfAbsent(chunk.lineStart(), chunk) != null) {
                log.warn("Duplicate chunk at {}:{} ignored", chunk.filePath(), chunk.lineStart());
            }
        }

        List<Chunk> toAdd = new ArrayList<>();
        List<Chunk> toUpdate = new ArrayList<>();
        int unchanged = 0;
        for (Map.Entry<Integer, Chunk> entry : fresh.entrySet()) {
            Point current = stored.get(entry.getKey());
            Chunk chunk = entry.getValue();
            if (current == null) {
                toAdd.add(chunk);
            } else if (!chunk.content().equals(PayloadFields.string(current.payload(), PayloadFields.CONTENT))
                    || current.isDeleted()) {
                toUpdate.add(chunk);
            } else {
                unchanged++;
            }
        }

        List<Long> toDelete = new ArrayList<>();
        for (Map.Entry<Integer, Point> entry : stored.entrySet()) {
            if (!fresh.containsKey(entry.getKey())) {
                toDelete.add(entry.getValue().id());
            }
        }
        return new ChunkDiff(toAdd, toUpdate, toDelete, unchanged);
    }
}
