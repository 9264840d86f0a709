package com.hybridrag.error;

import java.util.List;
import java.util.Map;

/**
 * Base of every failure that may cross the tool-call boundary. Carries a stable
 * {@link ErrorCode}, structured details and remediation suggestions.
 */
public class RagException extends RuntimeException {
    private final ErrorCode code;
    private final Map<String, Object> details;
    private final List<String> suggestions;

    public RagException(ErrorCode code, String message) {
        this(code, message, Map.of(), List.of(), null);
    }

    public RagException(ErrorCode code, String message, Map<String, Object> details, List<String> suggestions) {
        this(code, message, details, suggestions, null);
    }

    public RagException(ErrorCode code, String message, Map<String, Object> details, List<String> suggestions,
            Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null ? Map.of() : details;
        this.suggestions = suggestions == null || suggestions.isEmpty()
                ? ErrorSuggestions.forCode(code)
                : List.copyOf(suggestions);
    }

    public ErrorCode code() {
        return code;
    }

    public Map<String, Object> details() {
        return details;
    }

    public List<String> suggestions() {
        return suggestions;
    }
}
