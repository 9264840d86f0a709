package com.hybridrag.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hybridrag.pipeline.Citations;
import com.hybridrag.store.SearchResult;
import com.hybridrag.store.StoredPoint;

/**
 * Response-body builders. Point ids are always rendered as decimal strings so 63-bit ids
 * survive JSON consumers that parse numbers as doubles.
 */
final class ToolData {
    private ToolData() {
    }

    static Map<String, Object> point(StoredPoint point, boolean includeVector) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("vector_id", String.valueOf(point.id()));
        out.put("metadata", point.payload());
        out.put("is_deleted", point.isDeleted());
        if (includeVector && point.vector() != null) {
            out.put("vector", vectorList(point.vector()));
        }
        return out;
    }

    static Map<String, Object> hit(SearchResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("vector_id", String.valueOf(result.id()));
        out.put("score", result.score());
        out.put("metadata", result.metadata());
        return out;
    }

    static Map<String, Object> searchHit(SearchResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("vector_id", String.valueOf(result.id()));
        out.put("content", result.content());
        out.put("file_path", result.filePath());
        out.put("line_number", result.lineNumber());
        out.put("section", result.section());
        out.put("score", result.score());
        out.put("origin", result.origin().label());
        out.put("citation", Citations.format(result.filePath(), result.lineNumber()));
        return out;
    }

    static List<Float> vectorList(float[] vector) {
        List<Float> out = new ArrayList<>(vector.length);
        for (float value : vector) {
            out.add(value);
        }
        return out;
    }
}
