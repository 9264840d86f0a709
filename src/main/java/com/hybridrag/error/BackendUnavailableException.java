package com.hybridrag.error;

import java.util.List;
import java.util.Map;

public class BackendUnavailableException extends RagException {
    public BackendUnavailableException(String message) {
        super(ErrorCode.BACKEND_UNAVAILABLE, message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(ErrorCode.BACKEND_UNAVAILABLE, message, Map.of(), List.of(), cause);
    }

    public BackendUnavailableException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.BACKEND_UNAVAILABLE, message, details, List.of(), cause);
    }
}
