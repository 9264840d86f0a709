package com.hybridrag.tools;

import java.util.LinkedHashMap;
import java.util.Map;

import com.hybridrag.store.HybridPointStore;

class CollectionStatsTool extends AbstractTool {
    private final HybridPointStore store;

    CollectionStatsTool(HybridPointStore store) {
        super("collection_stats", "Point counts per collection.");
        this.store = store;
    }

    @Override
    Object execute(ToolArguments arguments) {
        Map<String, Object> out = new LinkedHashMap<>();
        store.stats().forEach((role, count) -> out.put(role.label(), count));
        return out;
    }
}
