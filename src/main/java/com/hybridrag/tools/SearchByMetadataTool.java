package com.hybridrag.tools;

import java.util.LinkedHashMap;
import java.util.Map;

import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.MetadataPage;
import com.hybridrag.store.PointFilter;

class SearchByMetadataTool extends AbstractTool {
    private final HybridPointStore store;

    SearchByMetadataTool(HybridPointStore store) {
        super("search_by_metadata", "List points whose payload matches a filter, with limit/offset paging.");
        this.store = store;
    }

    @Override
    Object execute(ToolArguments arguments) {
        MetadataPage page = store.searchByMetadata(
                PointFilter.fromMap(arguments.map("filter")),
                arguments.integer("limit", 10),
                arguments.integer("offset", 0));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("results", page.results().stream().map(point -> ToolData.point(point, false)).toList());
        out.put("count", page.results().size());
        out.put("limit", page.limit());
        out.put("offset", page.offset());
        out.put("filtered_in_process", page.filteredInProcess());
        return out;
    }
}
