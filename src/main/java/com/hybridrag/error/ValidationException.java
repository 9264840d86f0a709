package com.hybridrag.error;

import java.util.List;
import java.util.Map;

public class ValidationException extends RagException {
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details, List.of());
    }

    public ValidationException(String message, Map<String, Object> details, List<String> suggestions) {
        super(ErrorCode.VALIDATION_ERROR, message, details, suggestions);
    }
}
