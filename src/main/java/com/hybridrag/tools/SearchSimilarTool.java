package com.hybridrag.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.PointFilter;
import com.hybridrag.store.SearchResult;

class SearchSimilarTool extends AbstractTool {
    private final HybridPointStore store;

    SearchSimilarTool(HybridPointStore store) {
        super("search_similar", "Nearest-neighbour search by query text or raw vector, with an optional filter.");
        this.store = store;
    }

    @Override
    Object execute(ToolArguments arguments) {
        String query = arguments.string("query");
        List<SearchResult> results = store.searchSimilar(
                query,
                arguments.integer("top_k", 10),
                arguments.list("vector"),
                PointFilter.fromMap(arguments.map("filter")));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("results", results.stream().map(ToolData::hit).toList());
        out.put("count", results.size());
        out.put("query", query);
        return out;
    }
}
