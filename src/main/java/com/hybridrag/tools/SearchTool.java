package com.hybridrag.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.SearchResult;

class SearchTool extends AbstractTool {
    private final HybridPointStore store;
    private final int defaultTopK;

    SearchTool(HybridPointStore store, int defaultTopK) {
        super("search", "Hybrid search over documentation and code with citations.");
        this.store = store;
        this.defaultTopK = defaultTopK;
    }

    @Override
    Object execute(ToolArguments arguments) {
        String query = arguments.requiredString("query");
        int topK = arguments.integer("top_k", defaultTopK);
        List<SearchResult> results = arguments.bool("expand", false)
                ? store.searchWithExpansion(query, topK, topK)
                : store.search(query, topK);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("results", results.stream().map(ToolData::searchHit).toList());
        out.put("count", results.size());
        out.put("query", query);
        return out;
    }
}
