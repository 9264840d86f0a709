package com.hybridrag.error;

import java.util.List;
import java.util.Map;

public class DimensionMismatchException extends RagException {
    public DimensionMismatchException(String message) {
        super(ErrorCode.DIMENSION_MISMATCH, message);
    }

    public DimensionMismatchException(String message, Map<String, Object> details) {
        super(ErrorCode.DIMENSION_MISMATCH, message, details, List.of());
    }

    public DimensionMismatchException(String message, Map<String, Object> details, List<String> suggestions) {
        super(ErrorCode.DIMENSION_MISMATCH, message, details, suggestions);
    }
}
