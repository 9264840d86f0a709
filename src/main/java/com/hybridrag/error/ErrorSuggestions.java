package com.hybridrag.error;

import java.util.List;
import java.util.Map;

public final class ErrorSuggestions {
    private static final Map<ErrorCode, List<String>> SUGGESTIONS = Map.of(
            ErrorCode.VALIDATION_ERROR, List.of(
                    "Check that all required fields are provided",
                    "Verify field types match expected format",
                    "Review input schema documentation"),
            ErrorCode.DIMENSION_MISMATCH, List.of(
                    "Ensure vector has the dimension of the configured embedder",
                    "Check embedding model configuration",
                    "Verify every vector element is numeric"),
            ErrorCode.POINT_NOT_FOUND, List.of(
                    "Verify vector ID exists in collection",
                    "Check if vector was deleted",
                    "Use search_similar or search_by_metadata to find vector IDs"),
            ErrorCode.BATCH_LIMIT_EXCEEDED, List.of(
                    "Reduce the requested batch size",
                    "Paginate with offset and limit"),
            ErrorCode.BACKEND_UNAVAILABLE, List.of(
                    "Check point store connectivity and credentials",
                    "Retry the operation; writes are idempotent"),
            ErrorCode.CAPABILITY_UNAVAILABLE, List.of(
                    "Check the embedding endpoint configuration",
                    "Fall back to the local embedding provider"),
            ErrorCode.COLLECTION_ERROR, List.of(
                    "Verify collection exists",
                    "Check primary backend connection",
                    "Review collection configuration"));

    private static final List<String> GENERIC = List.of(
            "Check logs for more details",
            "Verify input parameters");

    private ErrorSuggestions() {
    }

    public static List<String> forCode(ErrorCode code) {
        return SUGGESTIONS.getOrDefault(code, GENERIC);
    }
}
