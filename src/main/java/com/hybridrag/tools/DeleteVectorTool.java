package com.hybridrag.tools;

import java.util.LinkedHashMap;
import java.util.Map;

import com.hybridrag.store.BackendRole;
import com.hybridrag.store.HybridPointStore;

class DeleteVectorTool extends AbstractTool {
    private final HybridPointStore store;

    DeleteVectorTool(HybridPointStore store) {
        super("delete_vector", "Delete a point, either softly (flag) or permanently.");
        this.store = store;
    }

    @Override
    Object execute(ToolArguments arguments) {
        long id = arguments.vectorId("vector_id");
        boolean soft = arguments.bool("soft_delete", false);
        store.delete(id, soft, arguments.role("collection", BackendRole.PRIMARY));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("vector_id", String.valueOf(id));
        out.put("deleted", true);
        out.put("soft_delete", soft);
        return out;
    }
}
