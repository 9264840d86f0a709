package com.hybridrag.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Uniform envelope for every tool call: {@code {success, data, metadata, errors}}.
 */
public record ToolResponse(boolean success, Object data, Map<String, Object> metadata, List<ToolError> errors) {

    public static ToolResponse ok(String operation, Object data, double timingMs) {
        return new ToolResponse(true, data, metadata(operation, timingMs), List.of());
    }

    public static ToolResponse failure(String operation, Throwable error, double timingMs) {
        return new ToolResponse(false, null, metadata(operation, timingMs), List.of(ToolError.from(error)));
    }

    private static Map<String, Object> metadata(String operation, double timingMs) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timing_ms", Math.round(timingMs * 100.0) / 100.0);
        metadata.put("operation", operation);
        return metadata;
    }
}
