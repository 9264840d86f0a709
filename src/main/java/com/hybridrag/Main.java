package com.hybridrag;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hybridrag.embedding.EmbeddingProvider;
import com.hybridrag.embedding.EmbeddingProviders;
import com.hybridrag.ingest.CodeChunker;
import com.hybridrag.ingest.CorpusScanner;
import com.hybridrag.ingest.IngestionService;
import com.hybridrag.ingest.MarkdownChunker;
import com.hybridrag.pipeline.AskPipeline;
import com.hybridrag.pipeline.AskResult;
import com.hybridrag.retrieval.AnswerSynthesizer;
import com.hybridrag.retrieval.QueryAnalyzer;
import com.hybridrag.retrieval.Reranker;
import com.hybridrag.runtime.AppConfig;
import com.hybridrag.runtime.AppConfigLoader;
import com.hybridrag.store.BackendRole;
import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.HybridStoreSettings;
import com.hybridrag.store.PointStoreBackend;
import com.hybridrag.store.PointStoreBackends;
import com.hybridrag.tools.Tool;
import com.hybridrag.tools.ToolRegistry;
import com.hybridrag.tools.ToolResponse;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "hybrid-rag",
        mixinStandardHelpOptions = true,
        version = "hybrid-rag 0.1.0",
        description = "Hybrid retrieval and incremental indexing over documentation and code.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "stats")
    Mode mode;

    @Option(names = "--query", description = "Query text for search mode")
    String query;

    @Option(names = "--question", description = "Question for ask mode")
    String question;

    @Option(names = "--context", description = "Optional context appended to the question")
    String context;

    @Option(names = "--top-k", description = "Results to return in search mode (defaults to retrieval.searchTopK)")
    Integer topK;

    @Option(names = "--expand", description = "Use section expansion in search mode", defaultValue = "false")
    boolean expand;

    @Option(names = "--target", description = "Backend for index/cleanup/recover/purge: cloud, local or both (index only)")
    String target;

    @Option(names = "--scope", description = "What index mode indexes: docs, code or all", defaultValue = "all")
    String scope;

    @Option(names = "--prune", description = "Soft-delete chunks of removed files after indexing (otherwise only counted)", defaultValue = "false")
    boolean prune;

    @Option(names = "--file", description = "Restrict recover/purge to one corpus-relative file")
    String file;

    @Option(names = "--commit", description = "Apply cleanup instead of previewing it", defaultValue = "false")
    boolean commit;

    @Option(names = "--dry-run", description = "Only count what recover would change", defaultValue = "false")
    boolean dryRun;

    @Option(names = "--confirm", description = "Required for purge to actually delete", defaultValue = "false")
    boolean confirm;

    @Option(names = "--tool", description = "Tool name for call mode")
    String toolName;

    @Option(names = "--args", description = "JSON object with tool arguments for call mode", defaultValue = "{}")
    String toolArgs;

    PrintStream out = System.out;

    private final OkHttpClient httpClient = new OkHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    enum Mode {
        index,
        search,
        ask,
        cleanup,
        recover,
        purge,
        stats,
        tools,
        call
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = new AppConfigLoader().load(Path.of(configPath));
        log.info("Starting hybrid-rag in {} mode", mode);
        log.info("Using config file: {}", configPath);

        EmbeddingProvider embeddings = EmbeddingProviders.fromConfig(config.getEmbedding(), httpClient);
        PointStoreBackend primary = PointStoreBackends.fromConfig(config.getPrimary(), BackendRole.PRIMARY, httpClient);
        PointStoreBackend secondary = PointStoreBackends.fromConfig(config.getSecondary(), BackendRole.SECONDARY, httpClient);
        HybridPointStore store = new HybridPointStore(primary, secondary, embeddings, HybridStoreSettings.fromConfig(config));
        store.ensureCollections();

        AppConfig.IndexingConfig indexing = config.getIndexing();
        CorpusScanner scanner = new CorpusScanner(Path.of(indexing.getProjectRoot()),
                indexing.getDocPatterns(), indexing.getCodePatterns(), indexing.getExcludePatterns());
        IngestionService ingestion = new IngestionService(scanner,
                new MarkdownChunker(indexing.getDocChunkSize(), indexing.getDocChunkOverlap()),
                new CodeChunker(indexing.getCodeChunkLines(), indexing.getCodeChunkOverlap()),
                store);
        AskPipeline pipeline = new AskPipeline(store, new QueryAnalyzer(), new Reranker(embeddings),
                new AnswerSynthesizer(), config.getRetrieval());
        ToolRegistry registry = ToolRegistry.create(store, pipeline, ingestion, scanner,
                config.getRetrieval().getSearchTopK());

        switch (mode) {
            case index:
                return print(registry, registry.call("index_repository", arguments(
                        "target", target == null ? defaultTargets(indexing.getTargets()) : target,
                        "scope", scope,
                        "prune", prune)));
            case search:
                if (query == null || query.isBlank()) {
                    log.error("--query is required in search mode");
                    return 2;
                }
                return print(registry, registry.call("search", arguments(
                        "query", query,
                        "top_k", topK == null ? config.getRetrieval().getSearchTopK() : topK,
                        "expand", expand)));
            case ask:
                if (question == null || question.isBlank()) {
                    log.error("--question is required in ask mode");
                    return 2;
                }
                AskResult result = pipeline.ask(question, context);
                out.println(result.answer());
                return result.failed() ? 1 : 0;
            case cleanup:
                return print(registry, registry.call("cleanup_deleted", arguments(
                        "collection", singleTarget(), "dry_run", !commit)));
            case recover:
                return print(registry, registry.call("recover_deleted", arguments(
                        "collection", singleTarget(), "file_path", file, "dry_run", dryRun)));
            case purge:
                return print(registry, registry.call("permanent_delete", arguments(
                        "collection", singleTarget(), "file_path", file, "confirm", confirm)));
            case stats:
                return print(registry, registry.call("collection_stats", Map.of()));
            case tools:
                for (Tool tool : registry.tools()) {
                    out.printf("%-20s %s%n", tool.name(), tool.description());
                }
                return 0;
            case call:
                if (toolName == null || toolName.isBlank()) {
                    log.error("--tool is required in call mode");
                    return 2;
                }
                Map<String, Object> parsed = mapper.readValue(toolArgs, new TypeReference<Map<String, Object>>() {
                });
                return print(registry, registry.call(toolName, parsed));
            default:
                return 2;
        }
    }

    private int print(ToolRegistry registry, ToolResponse response) {
        out.println(registry.toJson(response));
        return response.success() ? 0 : 1;
    }

    private String singleTarget() {
        return target == null ? BackendRole.PRIMARY.label() : target.toLowerCase(Locale.ROOT);
    }

    static String defaultTargets(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return BackendRole.PRIMARY.label();
        }
        boolean cloud = configured.stream().anyMatch(label -> BackendRole.fromLabel(label) == BackendRole.PRIMARY);
        boolean local = configured.stream().anyMatch(label -> BackendRole.fromLabel(label) == BackendRole.SECONDARY);
        if (cloud && local) {
            return "both";
        }
        return local ? BackendRole.SECONDARY.label() : BackendRole.PRIMARY.label();
    }

    private static Map<String, Object> arguments(Object... keyValues) {
        Map<String, Object> args = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                args.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return args;
    }
}
