package com.hybridrag.embedding;

import java.util.List;
import java.util.Map;

import com.hybridrag.error.ErrorCode;
import com.hybridrag.error.RagException;

/**
 * Raised when an embedding or reranking model cannot be reached or loaded.
 * Callers treat it as recoverable.
 */
public class CapabilityUnavailableException extends RagException {
    public CapabilityUnavailableException(String message) {
        super(ErrorCode.CAPABILITY_UNAVAILABLE, message);
    }

    public CapabilityUnavailableException(String message, Throwable cause) {
        super(ErrorCode.CAPABILITY_UNAVAILABLE, message, Map.of(), List.of(), cause);
    }
}
