package com.hybridrag.tools;

import com.hybridrag.store.BackendRole;
import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.StoredPoint;

class AddVectorTool extends AbstractTool {
    private final HybridPointStore store;

    AddVectorTool(HybridPointStore store) {
        super("add_vector", "Store new content (text, code, logs) with its embedding and metadata.");
        this.store = store;
    }

    @Override
    Object execute(ToolArguments arguments) {
        StoredPoint point = store.add(
                arguments.string("content"),
                arguments.map("metadata"),
                arguments.list("vector"),
                arguments.role("collection", BackendRole.PRIMARY));
        return ToolData.point(point, false);
    }
}
