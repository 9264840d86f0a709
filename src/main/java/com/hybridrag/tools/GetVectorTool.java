package com.hybridrag.tools;

import com.hybridrag.store.BackendRole;
import com.hybridrag.store.HybridPointStore;

class GetVectorTool extends AbstractTool {
    private final HybridPointStore store;

    GetVectorTool(HybridPointStore store) {
        super("get_vector", "Fetch a stored point by id, soft-deleted points included.");
        this.store = store;
    }

    @Override
    Object execute(ToolArguments arguments) {
        boolean includeVector = arguments.bool("include_vector", false);
        return ToolData.point(store.get(arguments.vectorId("vector_id"), includeVector,
                arguments.role("collection", BackendRole.PRIMARY)), includeVector);
    }
}
