package com.hybridrag.ingest;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.error.RagException;
import com.hybridrag.store.BackendRole;
import com.hybridrag.store.Chunk;
import com.hybridrag.store.HybridPointStore;

/**
 * Batch job: scan the corpus, re-index every matching file incrementally into each
 * target backend and count chunks of files that no longer exist. Those chunks are
 * soft-deleted only when the caller asks to prune.
 */
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    public enum Scope {
        DOCS,
        CODE,
        ALL
    }

    private final CorpusScanner scanner;
    private final MarkdownChunker markdownChunker;
    private final CodeChunker codeChunker;
    private final IncrementalIndexer indexer;
    private final HybridPointStore store;

    public IngestionService(CorpusScanner scanner,
            MarkdownChunker markdownChunker,
            CodeChunker codeChunker,
            HybridPointStore store) {
        this.scanner = scanner;
        this.markdownChunker = markdownChunker;
        this.codeChunker = codeChunker;
        this.store = store;
        this.indexer = new IncrementalIndexer(store);
    }

    public IngestionReport ingest(Set<BackendRole> targets, Scope scope, boolean prune) throws IOException {
        CorpusScanner.Corpus corpus = scanner.scan();
        int indexed = 0;
        int failed = 0;
        int skipped = 0;
        int chunkCount = 0;
        int total = 0;

        if (scope != Scope.CODE) {
            for (String file : corpus.docs()) {
                total++;
                FileResult result = indexOne(file, false, targets);
                switch (result.outcome()) {
                    case INDEXED -> indexed++;
                    case FAILED -> failed++;
                    case SKIPPED -> skipped++;
                }
                chunkCount += result.chunks();
            }
        }
        if (scope != Scope.DOCS) {
            for (String file : corpus.code()) {
                total++;
                FileResult result = indexOne(file, true, targets);
                switch (result.outcome()) {
                    case INDEXED -> indexed++;
                    case FAILED -> failed++;
                    case SKIPPED -> skipped++;
                }
                chunkCount += result.chunks();
            }
        }

        int stale = 0;
        Set<String> existing = new HashSet<>(corpus.all());
        for (BackendRole target : targets) {
            try {
                stale += store.cleanupDeletedFiles(existing, target, !prune);
            } catch (RagException e) {
                log.error("Cleanup of deleted files failed for {}: {}", target.label(), e.getMessage());
            }
        }
        if (stale > 0 && !prune) {
            log.info("{} chunks belong to removed files; re-run with prune to soft-delete them", stale);
        }
        IngestionReport report = new IngestionReport(indexed, failed, skipped, total, chunkCount, stale, prune);
        log.info("Ingestion finished: {}", report);
        return report;
    }

    private FileResult indexOne(String file, boolean code, Set<BackendRole> targets) {
        String content;
        try {
            content = Files.readString(scanner.resolve(file), StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.warn("Skipping {}: not valid UTF-8", file);
            return new FileResult(FileOutcome.SKIPPED, 0);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            return new FileResult(FileOutcome.FAILED, 0);
        }
        List<Chunk> chunks = code ? codeChunker.chunk(file, content) : markdownChunker.chunk(file, content);
        boolean ok = true;
        for (BackendRole target : targets) {
            ok &= indexer.indexFile(file, target, chunks);
        }
        if (!ok) {
            return new FileResult(FileOutcome.FAILED, 0);
        }
        return new FileResult(FileOutcome.INDEXED, chunks.size());
    }

    private record FileResult(FileOutcome outcome, int chunks) {
    }

    private enum FileOutcome {
        INDEXED,
        FAILED,
        SKIPPED
    }
}
