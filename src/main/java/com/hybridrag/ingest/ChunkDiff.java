package com.hybridrag.ingest;

import java.util.List;

import com.hybridrag.store.Chunk;

public record ChunkDiff(List<Chunk> toAdd, List<Chunk> toUpdate, List<Long> toDelete, int unchanged) {
    public boolean hasChanges() {
        return !toAdd.isEmpty() || !toUpdate.isEmpty() || !toDelete.isEmpty();
    }
}
