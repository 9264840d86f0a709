package com.hybridrag.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.embedding.ContentCategory;
import com.hybridrag.embedding.EmbeddingProvider;
import com.hybridrag.error.BackendUnavailableException;
import com.hybridrag.error.BatchLimitExceededException;
import com.hybridrag.error.PointNotFoundException;
import com.hybridrag.error.RagException;
import com.hybridrag.error.ValidationException;
import com.hybridrag.retrieval.KeywordScorer;

/**
 * Primary/secondary pair of point collections behind one search and mutation API.
 * Reads prefer the primary and consult the secondary only when the primary is short
 * or failing; writes always name their target explicitly.
 */
public class HybridPointStore {
    private static final Logger log = LoggerFactory.getLogger(HybridPointStore.class);
    private static final String UNKNOWN_SECTION = "Unknown";
    private static final int MAX_FALLBACK_SCAN = 10_000;

    private final PointStoreBackend primary;
    private final PointStoreBackend secondary;
    private final EmbeddingProvider embeddings;
    private final HybridStoreSettings settings;

    public HybridPointStore(PointStoreBackend primary,
            PointStoreBackend secondary,
            EmbeddingProvider embeddings,
            HybridStoreSettings settings) {
        if (settings.vectorWeight() < 0 || settings.keywordWeight() < 0) {
            throw new ValidationException("Hybrid weights must be non-negative");
        }
        if (Math.abs(settings.vectorWeight() + settings.keywordWeight() - 1.0) > 0.01) {
            throw new ValidationException("Weights must sum to 1.0, got vector=" + settings.vectorWeight()
                    + " keyword=" + settings.keywordWeight());
        }
        this.primary = primary;
        this.secondary = secondary == null ? new DisabledPointStoreBackend(BackendRole.SECONDARY.label()) : secondary;
        this.embeddings = embeddings;
        this.settings = settings;
    }

    public PointStoreBackend backend(BackendRole role) {
        return role == BackendRole.PRIMARY ? primary : secondary;
    }

    public boolean isEnabled(BackendRole role) {
        return backend(role).isEnabled();
    }

    public EmbeddingProvider embeddings() {
        return embeddings;
    }

    public HybridStoreSettings settings() {
        return settings;
    }

    public void ensureCollections() {
        int dimension = embeddings.dimension();
        for (BackendRole role : BackendRole.values()) {
            try {
                backend(role).ensureCollection(dimension);
            } catch (RagException e) {
                log.warn("Could not prepare {} collection {}: {}", role.label(), backend(role).name(), e.getMessage());
            }
        }
    }

    public Point pointFor(Chunk chunk) {
        return pointFor(chunk, null);
    }

    public Point pointFor(Chunk chunk, float[] vector) {
        float[] resolved = vector != null
                ? VectorValidator.validate(vector, embeddings.dimension())
                : embeddings.embed(chunk.content(), chunk.category());
        Map<String, Object> payload = chunk.toPayload();
        payload.put(PayloadFields.IS_DELETED, false);
        return new Point(PointIds.forChunk(chunk), resolved, payload);
    }

    public long upsert(Chunk chunk, BackendRole target) {
        return upsert(chunk, null, target);
    }

    public long upsert(Chunk chunk, float[] vector, BackendRole target) {
        Point point = pointFor(chunk, vector);
        backend(target).upsert(List.of(point));
        return point.id();
    }

    public StoredPoint add(String content, Map<String, Object> metadata, List<?> vector, BackendRole target) {
        PointStoreBackend backend = requireEnabled(target);
        boolean hasContent = content != null && !content.isBlank();
        boolean hasVector = vector != null && !vector.isEmpty();
        if (!hasContent && !hasVector) {
            throw new ValidationException("Either content or vector must be provided");
        }
        Map<String, Object> payload = new LinkedHashMap<>(metadata == null ? Map.of() : metadata);
        if (hasContent) {
            payload.put(PayloadFields.CONTENT, content);
        }
        if (payload.containsKey(PayloadFields.FILE_PATH)) {
            payload.put(PayloadFields.FILE_PATH, PayloadFields.normalizePath(PayloadFields.string(payload, PayloadFields.FILE_PATH)));
        }
        payload.putIfAbsent(PayloadFields.IS_DELETED, false);
        float[] resolved = hasVector
                ? VectorValidator.validate(vector, embeddings.dimension())
                : embeddings.embed(content, categoryOf(payload));
        long id = idFor(payload, hasContent ? content : Arrays.toString(resolved));
        backend.upsert(List.of(new Point(id, resolved, payload)));
        log.debug("Added point {} to {}", id, target.label());
        return new StoredPoint(id, payload, resolved);
    }

    public StoredPoint get(long id, boolean includeVector, BackendRole target) {
        Point point = find(requireEnabled(target), id, includeVector, target);
        return new StoredPoint(point.id(), point.payload(), point.vector());
    }

    public StoredPoint update(long id, String content, Map<String, Object> metadata, List<?> vector, BackendRole target) {
        PointStoreBackend backend = requireEnabled(target);
        boolean hasContent = content != null && !content.isBlank();
        boolean hasVector = vector != null && !vector.isEmpty();
        boolean hasMetadata = metadata != null && !metadata.isEmpty();
        if (!hasContent && !hasVector && !hasMetadata) {
            throw new ValidationException("Nothing to update: provide content, metadata or vector");
        }
        Point existing = find(backend, id, true, target);
        String previousContent = PayloadFields.string(existing.payload(), PayloadFields.CONTENT);

        Map<String, Object> payload = new LinkedHashMap<>(existing.payload());
        if (hasMetadata) {
            payload.putAll(metadata);
        }
        if (hasContent) {
            payload.put(PayloadFields.CONTENT, content);
        }

        float[] resolved;
        if (hasVector) {
            resolved = VectorValidator.validate(vector, embeddings.dimension());
        } else if (hasContent && !content.equals(previousContent)) {
            resolved = embeddings.embed(content, categoryOf(payload));
        } else if (existing.vector() != null) {
            resolved = existing.vector();
        } else {
            String stored = PayloadFields.string(payload, PayloadFields.CONTENT);
            if (stored.isBlank()) {
                throw new ValidationException("Point " + id + " has no stored vector or content to re-embed");
            }
            resolved = embeddings.embed(stored, categoryOf(payload));
        }
        backend.upsert(List.of(new Point(id, resolved, payload)));
        return new StoredPoint(id, payload, resolved);
    }

    public void delete(long id, boolean soft, BackendRole target) {
        PointStoreBackend backend = requireEnabled(target);
        find(backend, id, false, target);
        if (soft) {
            backend.setPayload(List.of(id), Map.of(PayloadFields.IS_DELETED, true));
        } else {
            backend.delete(List.of(id));
        }
        log.info("{} point {} in {}", soft ? "Soft-deleted" : "Deleted", id, target.label());
    }

    public long deleteAll(BackendRole target, boolean confirm) {
        if (!confirm) {
            throw new ValidationException("delete_all requires confirm=true", Map.of("collection", target.label()),
                    List.of("Set confirm=true to delete every point", "Use delete_vector for single points"));
        }
        PointStoreBackend backend = requireEnabled(target);
        List<Long> ids = scanAll(backend, null).stream().map(Point::id).toList();
        int deleted = deleteInBatches(backend, ids);
        log.warn("Deleted all {} points from {}", deleted, target.label());
        return deleted;
    }

    public List<SearchResult> search(String query, int topK) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query must not be empty");
        }
        int limit = clamp(topK, settings.maxSearchTopK(), "top_k");
        float[] queryVector = embeddings.embed(query, ContentCategory.DOC);

        Map<String, SearchResult> merged = new LinkedHashMap<>();
        RagException primaryFailure = null;
        try {
            collectNearest(primary, BackendRole.PRIMARY, queryVector, limit * 2, merged);
        } catch (RagException e) {
            primaryFailure = e;
            log.warn("Primary search failed, trying secondary: {}", e.getMessage());
        }
        boolean secondaryAnswered = false;
        if (liveCount(merged.values()) < limit && secondary.isEnabled()) {
            try {
                collectNearest(secondary, BackendRole.SECONDARY, queryVector, limit * 2, merged);
                secondaryAnswered = true;
            } catch (RagException e) {
                log.error("Secondary search failed: {}", e.getMessage());
            }
        }
        if (primaryFailure != null && !secondaryAnswered) {
            throw new BackendUnavailableException("Search failed on every backend", primaryFailure);
        }

        return merged.values().stream()
                .filter(result -> !result.isDeleted())
                .map(result -> blend(query, result))
                .sorted(Comparator.comparing(SearchResult::score).reversed())
                .limit(limit)
                .toList();
    }

    public List<SearchResult> searchWithExpansion(String query, int topK, int rerankTopK) {
        List<SearchResult> initial = search(query, topK);
        if (initial.isEmpty()) {
            return initial;
        }
        int limit = clamp(rerankTopK, settings.maxScanLimit(), "rerank_top_k");
        try {
            Map<String, List<SearchResult>> groups = new LinkedHashMap<>();
            for (SearchResult result : initial) {
                groups.computeIfAbsent(result.filePath() + "#" + sectionOf(result), unused -> new ArrayList<>())
                        .add(result);
            }
            Map<String, SearchResult> merged = new LinkedHashMap<>();
            for (List<SearchResult> group : groups.values()) {
                group.forEach(result -> merged.putIfAbsent(result.mergeKey(), result));
                SearchResult head = group.get(0);
                if (head.filePath().isBlank()) {
                    continue;
                }
                float best = group.stream().map(SearchResult::score).max(Float::compare).orElse(0f);
                try {
                    for (SearchResult sibling : sectionChunks(head.filePath(), sectionOf(head))) {
                        merged.putIfAbsent(sibling.mergeKey(), sibling.withScore(best));
                    }
                } catch (RagException e) {
                    log.warn("Section expansion failed for {}#{}, keeping original hits: {}",
                            head.filePath(), sectionOf(head), e.getMessage());
                }
            }
            return merged.values().stream()
                    .filter(result -> !result.isDeleted())
                    .sorted(Comparator.comparing(SearchResult::score).reversed())
                    .limit(limit)
                    .toList();
        } catch (RuntimeException e) {
            log.error("Search with expansion failed, falling back to plain search", e);
            return search(query, rerankTopK);
        }
    }

    public List<SearchResult> searchSimilar(String query, int topK, List<?> vector, PointFilter filter) {
        int limit = clamp(topK, settings.maxSearchTopK(), "top_k");
        float[] queryVector;
        if (vector != null && !vector.isEmpty()) {
            queryVector = VectorValidator.validate(vector, embeddings.dimension());
        } else if (query != null && !query.isBlank()) {
            queryVector = embeddings.embed(query, ContentCategory.DOC);
        } else {
            throw new ValidationException("Either query or vector must be provided");
        }
        PointFilter effective = filter == null ? PointFilter.empty() : filter;

        List<ScoredPoint> hits;
        try {
            hits = primary.nearest(queryVector, limit * 2, effective);
        } catch (UnsupportedFilterException e) {
            log.warn("Backend rejected filter {}, evaluating in process: {}", effective, e.getMessage());
            hits = primary.nearest(queryVector, Math.min(limit * 10, MAX_FALLBACK_SCAN), null).stream()
                    .filter(hit -> effective.matches(hit.point().payload()))
                    .toList();
        }
        return hits.stream()
                .filter(hit -> !hit.point().isDeleted())
                .map(hit -> SearchResult.from(hit.point(), hit.score(), BackendRole.PRIMARY))
                .limit(limit)
                .toList();
    }

    public MetadataPage searchByMetadata(PointFilter filter, int limit, long offset) {
        int pageSize = clamp(limit, settings.maxScanLimit(), "limit");
        if (offset < 0) {
            throw new ValidationException("offset must be non-negative");
        }
        PointFilter effective = filter == null ? PointFilter.empty() : filter;
        try {
            List<StoredPoint> page = new ArrayList<>();
            long skipped = 0;
            Long cursor = null;
            do {
                ScanPage scan = primary.scan(effective, settings.maxScanLimit(), cursor);
                for (Point point : scan.points()) {
                    if (point.isDeleted()) {
                        continue;
                    }
                    if (skipped < offset) {
                        skipped++;
                        continue;
                    }
                    page.add(new StoredPoint(point.id(), point.payload(), null));
                    if (page.size() == pageSize) {
                        return new MetadataPage(page, pageSize, offset, false);
                    }
                }
                cursor = advance(cursor, scan.nextOffset());
            } while (cursor != null);
            return new MetadataPage(page, pageSize, offset, false);
        } catch (UnsupportedFilterException e) {
            if (offset + pageSize > MAX_FALLBACK_SCAN) {
                throw new BatchLimitExceededException("Filter on unindexed fields cannot page past "
                        + MAX_FALLBACK_SCAN + " points",
                        Map.of("offset", offset, "limit", pageSize, "max_scan", MAX_FALLBACK_SCAN),
                        List.of("Filter on an indexed field such as " + PayloadFields.FILE_PATH,
                                "Narrow the filter so fewer pages are needed"));
            }
            int budget = (int) Math.min((offset + pageSize) * 10L, MAX_FALLBACK_SCAN);
            log.warn("Backend rejected filter {}, scanning {} points in process: {}", effective, budget, e.getMessage());
            List<StoredPoint> page = scanUpTo(primary, budget).stream()
                    .filter(point -> !point.isDeleted())
                    .filter(point -> effective.matches(point.payload()))
                    .skip(offset)
                    .limit(pageSize)
                    .map(point -> new StoredPoint(point.id(), point.payload(), null))
                    .toList();
            return new MetadataPage(page, pageSize, offset, true);
        }
    }

    public int cleanupDeletedFiles(Set<String> existingPaths, BackendRole target, boolean dryRun) {
        PointStoreBackend backend = backend(target);
        if (!backend.isEnabled()) {
            return 0;
        }
        Set<String> known = new HashSet<>();
        for (String path : existingPaths) {
            known.add(PayloadFields.normalizePath(path));
        }
        List<Long> orphaned = new ArrayList<>();
        Set<String> missingFiles = new HashSet<>();
        for (Point point : scanAll(backend, null)) {
            String filePath = point.filePath();
            if (point.isDeleted() || filePath.isBlank() || known.contains(filePath)) {
                continue;
            }
            orphaned.add(point.id());
            missingFiles.add(filePath);
        }
        if (orphaned.isEmpty()) {
            log.info("No chunks of deleted files found in {}", target.label());
            return 0;
        }
        if (dryRun) {
            log.info("[dry-run] Would mark {} chunks from {} missing files as deleted in {}",
                    orphaned.size(), missingFiles.size(), target.label());
            return orphaned.size();
        }
        int marked = setDeletedFlag(backend, orphaned, true);
        log.info("Marked {} chunks from {} missing files as deleted in {}", marked, missingFiles.size(), target.label());
        return marked;
    }

    public LifecycleReport recover(BackendRole target, String filePath, boolean dryRun) {
        PointStoreBackend backend = backend(target);
        if (!backend.isEnabled()) {
            return new LifecycleReport(target, 0, 0, dryRun);
        }
        List<Long> ids = softDeletedIds(backend, filePath);
        if (dryRun || ids.isEmpty()) {
            log.info("{} soft-deleted chunks recoverable in {}{}", ids.size(), target.label(), scopeSuffix(filePath));
            return new LifecycleReport(target, ids.size(), 0, dryRun);
        }
        int recovered = setDeletedFlag(backend, ids, false);
        log.info("Recovered {} chunks in {}{}", recovered, target.label(), scopeSuffix(filePath));
        return new LifecycleReport(target, ids.size(), recovered, false);
    }

    public int recover(List<Long> ids, BackendRole target) {
        PointStoreBackend backend = requireEnabled(target);
        List<Long> deleted = backend.retrieve(ids, false).stream()
                .filter(Point::isDeleted)
                .map(Point::id)
                .toList();
        return setDeletedFlag(backend, deleted, false);
    }

    public LifecycleReport permanentDelete(BackendRole target, String filePath, boolean confirm) {
        PointStoreBackend backend = backend(target);
        if (!backend.isEnabled()) {
            return new LifecycleReport(target, 0, 0, !confirm);
        }
        List<Long> ids = softDeletedIds(backend, filePath);
        if (!confirm || ids.isEmpty()) {
            log.info("{} soft-deleted chunks would be permanently removed from {}{}",
                    ids.size(), target.label(), scopeSuffix(filePath));
            return new LifecycleReport(target, ids.size(), 0, !confirm);
        }
        int removed = deleteInBatches(backend, ids);
        log.warn("Permanently deleted {} chunks from {}{}", removed, target.label(), scopeSuffix(filePath));
        return new LifecycleReport(target, ids.size(), removed, false);
    }

    public Map<BackendRole, Long> stats() {
        Map<BackendRole, Long> counts = new LinkedHashMap<>();
        for (BackendRole role : BackendRole.values()) {
            long count = 0;
            try {
                count = backend(role).count();
            } catch (RagException e) {
                log.warn("Could not count points in {}: {}", role.label(), e.getMessage());
            }
            counts.put(role, count);
        }
        return counts;
    }

    public List<Point> scanAll(BackendRole target, PointFilter filter) {
        return scanAll(backend(target), filter);
    }

    // Soft-deleted hits still claim their merge key so a stale copy on a later backend
    // cannot take the slot; callers drop them after merging.
    private void collectNearest(PointStoreBackend backend, BackendRole role, float[] queryVector, int limit,
            Map<String, SearchResult> merged) {
        for (ScoredPoint hit : backend.nearest(queryVector, limit, null)) {
            SearchResult result = SearchResult.from(hit.point(), hit.score(), role);
            merged.putIfAbsent(result.mergeKey(), result);
        }
    }

    private static long liveCount(Collection<SearchResult> results) {
        return results.stream().filter(result -> !result.isDeleted()).count();
    }

    private SearchResult blend(String query, SearchResult result) {
        if (settings.keywordWeight() <= 0) {
            return result;
        }
        double blended = settings.vectorWeight() * result.score()
                + settings.keywordWeight() * KeywordScorer.score(query, result.content());
        return result.withScore((float) blended);
    }

    /** Section members from both backends, primary first, soft-deleted ones included. */
    private List<SearchResult> sectionChunks(String filePath, String section) {
        PointFilter filter = PointFilter.builder()
                .must(PayloadFields.FILE_PATH, filePath)
                .must(PayloadFields.SECTION, section)
                .build();
        List<SearchResult> chunks = new ArrayList<>();
        RagException primaryFailure = null;
        try {
            scanAll(primary, filter)
                    .forEach(point -> chunks.add(SearchResult.from(point, 0f, BackendRole.PRIMARY)));
        } catch (RagException e) {
            primaryFailure = e;
            log.warn("Primary section scan failed for {}#{}: {}", filePath, section, e.getMessage());
        }
        if (liveCount(chunks) < settings.sectionExpansionThreshold() && secondary.isEnabled()) {
            try {
                scanAll(secondary, filter)
                        .forEach(point -> chunks.add(SearchResult.from(point, 0f, BackendRole.SECONDARY)));
                return chunks;
            } catch (RagException e) {
                log.warn("Secondary section scan failed for {}#{}: {}", filePath, section, e.getMessage());
            }
        }
        if (primaryFailure != null) {
            throw primaryFailure;
        }
        return chunks;
    }

    private List<Point> scanAll(PointStoreBackend backend, PointFilter filter) {
        List<Point> out = new ArrayList<>();
        Long cursor = null;
        do {
            ScanPage page = backend.scan(filter, settings.maxScanLimit(), cursor);
            out.addAll(page.points());
            cursor = advance(cursor, page.nextOffset());
        } while (cursor != null);
        return out;
    }

    private List<Point> scanUpTo(PointStoreBackend backend, int budget) {
        List<Point> out = new ArrayList<>();
        Long cursor = null;
        do {
            ScanPage page = backend.scan(null, Math.min(settings.maxScanLimit(), budget - out.size()), cursor);
            out.addAll(page.points());
            cursor = advance(cursor, page.nextOffset());
        } while (cursor != null && out.size() < budget);
        return out;
    }

    private static Long advance(Long current, Long next) {
        return next == null || next.equals(current) ? null : next;
    }

    private List<Long> softDeletedIds(PointStoreBackend backend, String filePath) {
        PointFilter filter = filePath == null || filePath.isBlank() ? null : PointFilter.fileEquals(filePath);
        return scanAll(backend, filter).stream()
                .filter(Point::isDeleted)
                .map(Point::id)
                .toList();
    }

    private int setDeletedFlag(PointStoreBackend backend, List<Long> ids, boolean deleted) {
        Map<String, Object> flag = Map.of(PayloadFields.IS_DELETED, deleted);
        int changed = 0;
        for (List<Long> batch : batches(ids)) {
            try {
                backend.setPayload(batch, flag);
                changed += batch.size();
            } catch (RuntimeException e) {
                log.warn("Batch update of {} points failed, retrying one by one: {}", batch.size(), e.getMessage());
                for (Long id : batch) {
                    try {
                        backend.setPayload(List.of(id), flag);
                        changed++;
                    } catch (RuntimeException single) {
                        log.error("Failed to update point {}: {}", id, single.getMessage());
                    }
                }
            }
        }
        return changed;
    }

    private int deleteInBatches(PointStoreBackend backend, List<Long> ids) {
        int removed = 0;
        for (List<Long> batch : batches(ids)) {
            try {
                backend.delete(batch);
                removed += batch.size();
            } catch (RuntimeException e) {
                log.warn("Batch delete of {} points failed, retrying one by one: {}", batch.size(), e.getMessage());
                for (Long id : batch) {
                    try {
                        backend.delete(List.of(id));
                        removed++;
                    } catch (RuntimeException single) {
                        log.error("Failed to delete point {}: {}", id, single.getMessage());
                    }
                }
            }
        }
        return removed;
    }

    private List<List<Long>> batches(List<Long> ids) {
        int size = Math.max(1, settings.mutationBatchSize());
        List<List<Long>> out = new ArrayList<>();
        for (int start = 0; start < ids.size(); start += size) {
            out.add(ids.subList(start, Math.min(ids.size(), start + size)));
        }
        return out;
    }

    private PointStoreBackend requireEnabled(BackendRole target) {
        PointStoreBackend backend = backend(target);
        if (!backend.isEnabled()) {
            throw new BackendUnavailableException("The " + target.label() + " collection is disabled");
        }
        return backend;
    }

    private Point find(PointStoreBackend backend, long id, boolean withVector, BackendRole target) {
        List<Point> found = backend.retrieve(List.of(id), withVector);
        if (found.isEmpty()) {
            throw new PointNotFoundException("Vector " + id + " not found in " + target.label() + " collection",
                    Map.of("vector_id", String.valueOf(id), "collection", target.label()));
        }
        return found.get(0);
    }

    private int clamp(int requested, int max, String name) {
        if (requested < 1) {
            log.warn("{}={} below 1, using 1", name, requested);
            return 1;
        }
        if (requested > max) {
            log.warn("{}={} exceeds maximum {}, clamping", name, requested, max);
            return max;
        }
        return requested;
    }

    private static long idFor(Map<String, Object> payload, String contentForId) {
        String filePath = PayloadFields.string(payload, PayloadFields.FILE_PATH);
        if (!filePath.isBlank()) {
            return PointIds.forFile(filePath, PayloadFields.integer(payload, PayloadFields.LINE_START));
        }
        return PointIds.forContent(contentForId);
    }

    private static ContentCategory categoryOf(Map<String, Object> payload) {
        boolean code = !PayloadFields.string(payload, PayloadFields.LANGUAGE).isBlank()
                || ContentType.CODE.label().equals(PayloadFields.string(payload, PayloadFields.CONTENT_TYPE));
        return code ? ContentCategory.CODE : ContentCategory.DOC;
    }

    private static String sectionOf(SearchResult result) {
        String section = result.section();
        return section == null ? UNKNOWN_SECTION : section;
    }

    private static String scopeSuffix(String filePath) {
        return filePath == null || filePath.isBlank() ? "" : " for " + PayloadFields.normalizePath(filePath);
    }
}
