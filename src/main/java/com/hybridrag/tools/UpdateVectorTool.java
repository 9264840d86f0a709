package com.hybridrag.tools;

import com.hybridrag.store.BackendRole;
import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.StoredPoint;

class UpdateVectorTool extends AbstractTool {
    private final HybridPointStore store;

    UpdateVectorTool(HybridPointStore store) {
        super("update_vector", "Update the content, metadata or vector of a stored point.");
        this.store = store;
    }

    @Override
    Object execute(ToolArguments arguments) {
        StoredPoint point = store.update(
                arguments.vectorId("vector_id"),
                arguments.string("content"),
                arguments.map("metadata"),
                arguments.list("vector"),
                arguments.role("collection", BackendRole.PRIMARY));
        return ToolData.point(point, false);
    }
}
