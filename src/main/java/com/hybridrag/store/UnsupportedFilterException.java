package com.hybridrag.store;

import java.util.List;
import java.util.Map;

import com.hybridrag.error.ErrorCode;
import com.hybridrag.error.RagException;

/**
 * Raised by a backend that cannot evaluate a filter server-side (for example a
 * predicate on a field without a payload index).
 */
public class UnsupportedFilterException extends RagException {
    public UnsupportedFilterException(String message) {
        super(ErrorCode.COLLECTION_ERROR, message);
    }

    public UnsupportedFilterException(String message, Throwable cause) {
        super(ErrorCode.COLLECTION_ERROR, message, Map.of(), List.of(), cause);
    }
}
