package com.hybridrag.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hybridrag.store.BackendRole;
import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.LifecycleReport;
import com.hybridrag.store.PointIds;

class RecoverDeletedTool extends AbstractTool {
    private final HybridPointStore store;

    RecoverDeletedTool(HybridPointStore store) {
        super("recover_deleted", "Clear the soft-delete flag, by ids or for a file (or everything).");
        this.store = store;
    }

    @Override
    Object execute(ToolArguments arguments) {
        BackendRole target = arguments.role("collection", BackendRole.PRIMARY);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("collection", target.label());
        List<?> rawIds = arguments.list("vector_ids");
        if (rawIds != null) {
            List<Long> ids = new ArrayList<>();
            for (Object rawId : rawIds) {
                ids.add(PointIds.parse(rawId));
            }
            out.put("recovered", store.recover(ids, target));
            return out;
        }
        LifecycleReport report = store.recover(target, arguments.string("file_path"), arguments.bool("dry_run", false));
        out.put("dry_run", report.dryRun());
        out.put("matched", report.matched());
        out.put("recovered", report.changed());
        return out;
    }
}
