package com.hybridrag.error;

import java.util.List;
import java.util.Map;

public class BatchLimitExceededException extends RagException {
    public BatchLimitExceededException(String message) {
        super(ErrorCode.BATCH_LIMIT_EXCEEDED, message);
    }

    public BatchLimitExceededException(String message, Map<String, Object> details) {
        super(ErrorCode.BATCH_LIMIT_EXCEEDED, message, details, List.of());
    }

    public BatchLimitExceededException(String message, Map<String, Object> details, List<String> suggestions) {
        super(ErrorCode.BATCH_LIMIT_EXCEEDED, message, details, suggestions);
    }
}
