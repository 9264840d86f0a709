package com.hybridrag.tools;

import java.util.LinkedHashMap;
import java.util.Map;

import com.hybridrag.store.BackendRole;
import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.LifecycleReport;

class PermanentDeleteTool extends AbstractTool {
    private final HybridPointStore store;

    PermanentDeleteTool(HybridPointStore store) {
        super("permanent_delete", "Physically remove soft-deleted points. Without confirm=true only previews.");
        this.store = store;
    }

    @Override
    Object execute(ToolArguments arguments) {
        BackendRole target = arguments.role("collection", BackendRole.PRIMARY);
        boolean confirm = arguments.bool("confirm", false);
        LifecycleReport report = store.permanentDelete(target, arguments.string("file_path"), confirm);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("collection", target.label());
        out.put("confirmed", confirm);
        out.put("matched", report.matched());
        out.put("deleted", report.changed());
        return out;
    }
}
