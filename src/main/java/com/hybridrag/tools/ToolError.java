package com.hybridrag.tools;

import java.util.List;
import java.util.Map;

import com.hybridrag.error.ErrorCode;
import com.hybridrag.error.ErrorSuggestions;
import com.hybridrag.error.RagException;

public record ToolError(String code, String message, Map<String, Object> details, List<String> suggestions) {

    public static ToolError from(Throwable error) {
        if (error instanceof RagException rag) {
            return new ToolError(rag.code().name(), rag.getMessage(), rag.details(), rag.suggestions());
        }
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new ToolError(ErrorCode.UNKNOWN_ERROR.name(), message, Map.of(),
                ErrorSuggestions.forCode(ErrorCode.UNKNOWN_ERROR));
    }
}
