package com.hybridrag.ingest;

/**
 * Outcome of one ingestion run. {@code staleChunks} counts live chunks whose file is gone;
 * they were soft-deleted only if {@code pruned} is set.
 */
public record IngestionReport(int indexed, int failed, int skipped, int total, int chunks,
        int staleChunks, boolean pruned) {

    public int softDeleted() {
        return pruned ? staleChunks : 0;
    }
}
