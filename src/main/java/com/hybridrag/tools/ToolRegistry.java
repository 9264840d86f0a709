package com.hybridrag.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hybridrag.error.ValidationException;
import com.hybridrag.ingest.CorpusScanner;
import com.hybridrag.ingest.IngestionService;
import com.hybridrag.pipeline.AskPipeline;
import com.hybridrag.store.HybridPointStore;

public class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static ToolRegistry create(HybridPointStore store,
            AskPipeline pipeline,
            IngestionService ingestion,
            CorpusScanner scanner,
            int defaultTopK) {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new AddVectorTool(store));
        registry.register(new GetVectorTool(store));
        registry.register(new UpdateVectorTool(store));
        registry.register(new DeleteVectorTool(store));
        registry.register(new DeleteAllTool(store));
        registry.register(new SearchSimilarTool(store));
        registry.register(new SearchByMetadataTool(store));
        registry.register(new SearchTool(store, defaultTopK));
        registry.register(new AskTool(pipeline));
        registry.register(new IndexRepositoryTool(ingestion, store));
        registry.register(new CleanupDeletedTool(store, scanner));
        registry.register(new RecoverDeletedTool(store));
        registry.register(new PermanentDeleteTool(store));
        registry.register(new CollectionStatsTool(store));
        return registry;
    }

    public void register(Tool tool) {
        if (tools.putIfAbsent(tool.name(), tool) != null) {
            throw new IllegalArgumentException("Tool already registered: " + tool.name());
        }
    }

    public List<Tool> tools() {
        return new ArrayList<>(tools.values());
    }

    public ToolResponse call(String name, Map<String, Object> arguments) {
        Tool tool = tools.get(name);
        if (tool == null) {
            return ToolResponse.failure(name, new ValidationException("Unknown tool: " + name,
                    Map.of("available", List.copyOf(tools.keySet()))), 0);
        }
        return tool.call(arguments);
    }

    public String toJson(ToolResponse response) {
        try {
            return mapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise tool response", e);
        }
    }
}
