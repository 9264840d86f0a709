package com.hybridrag.error;

import java.util.List;
import java.util.Map;

public class PointNotFoundException extends RagException {
    public PointNotFoundException(String message) {
        super(ErrorCode.POINT_NOT_FOUND, message);
    }

    public PointNotFoundException(String message, Map<String, Object> details) {
        super(ErrorCode.POINT_NOT_FOUND, message, details, List.of());
    }

    public PointNotFoundException(String message, Map<String, Object> details, List<String> suggestions) {
        super(ErrorCode.POINT_NOT_FOUND, message, details, suggestions);
    }
}
