package com.hybridrag.store;

/**
 * Outcome of a bulk soft-delete, recovery or purge. {@code matched} is the number of
 * points selected, {@code changed} the number actually mutated (0 on dry runs).
 */
public record LifecycleReport(BackendRole backend, int matched, int changed, boolean dryRun) {
}
