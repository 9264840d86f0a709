package com.hybridrag.error;

import java.util.List;
import java.util.Map;

public class RerankException extends RagException {
    public RerankException(String message) {
        super(ErrorCode.RERANK_FAILURE, message);
    }

    public RerankException(String message, Throwable cause) {
        super(ErrorCode.RERANK_FAILURE, message, Map.of(), List.of(), cause);
    }

    public RerankException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.RERANK_FAILURE, message, details, List.of(), cause);
    }
}
