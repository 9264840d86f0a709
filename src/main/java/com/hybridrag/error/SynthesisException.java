package com.hybridrag.error;

import java.util.List;
import java.util.Map;

public class SynthesisException extends RagException {
    public SynthesisException(String message) {
        super(ErrorCode.SYNTHESIS_FAILURE, message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(ErrorCode.SYNTHESIS_FAILURE, message, Map.of(), List.of(), cause);
    }

    public SynthesisException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.SYNTHESIS_FAILURE, message, details, List.of(), cause);
    }
}
