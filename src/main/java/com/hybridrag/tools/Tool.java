package com.hybridrag.tools;

import java.util.Map;

public interface Tool {
    String name();

    String description();

    ToolResponse call(Map<String, Object> arguments);
}
