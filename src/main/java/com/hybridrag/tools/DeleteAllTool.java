package com.hybridrag.tools;

import java.util.LinkedHashMap;
import java.util.Map;

import com.hybridrag.store.BackendRole;
import com.hybridrag.store.HybridPointStore;

class DeleteAllTool extends AbstractTool {
    private final HybridPointStore store;

    DeleteAllTool(HybridPointStore store) {
        super("delete_all", "Delete every point of a collection. Requires confirm=true.");
        this.store = store;
    }

    @Override
    Object execute(ToolArguments arguments) {
        BackendRole target = arguments.role("collection", BackendRole.PRIMARY);
        long deleted = store.deleteAll(target, arguments.bool("confirm", false));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("collection", target.label());
        out.put("deleted_count", deleted);
        return out;
    }
}
