package com.hybridrag.error;

public enum ErrorCode {
    VALIDATION_ERROR,
    POINT_NOT_FOUND,
    DIMENSION_MISMATCH,
    BATCH_LIMIT_EXCEEDED,
    BACKEND_UNAVAILABLE,
    CAPABILITY_UNAVAILABLE,
    SYNTHESIS_FAILURE,
    RERANK_FAILURE,
    COLLECTION_ERROR,
    UNKNOWN_ERROR
}
