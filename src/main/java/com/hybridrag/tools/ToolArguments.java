package com.hybridrag.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hybridrag.error.ValidationException;
import com.hybridrag.store.BackendRole;
import com.hybridrag.store.PointIds;

/**
 * Typed view over the loosely typed JSON arguments of a tool call.
 */
final class ToolArguments {
    private final Map<String, Object> raw;

    ToolArguments(Map<String, Object> raw) {
        this.raw = raw == null ? Map.of() : raw;
    }

    String string(String name) {
        Object value = raw.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new ValidationException(name + " must be a string");
        }
        return text;
    }

    String requiredString(String name) {
        String value = string(name);
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " is required and must be a non-empty string");
        }
        return value;
    }

    int integer(String name, int defaultValue) {
        Object value = raw.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(name + " must be an integer: " + text);
            }
        }
        throw new ValidationException(name + " must be an integer");
    }

    boolean bool(String name, boolean defaultValue) {
        Object value = raw.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text && (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false"))) {
            return Boolean.parseBoolean(text);
        }
        throw new ValidationException(name + " must be a boolean");
    }

    Map<String, Object> map(String name) {
        Object value = raw.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> entries)) {
            throw new ValidationException(name + " must be an object");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        entries.forEach((key, entry) -> copy.put(String.valueOf(key), entry));
        return copy;
    }

    List<?> list(String name) {
        Object value = raw.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw new ValidationException(name + " must be a list");
        }
        return list;
    }

    long vectorId(String name) {
        if (!raw.containsKey(name)) {
            throw new ValidationException(name + " is required");
        }
        return PointIds.parse(raw.get(name));
    }

    BackendRole role(String name, BackendRole defaultRole) {
        String value = string(name);
        return value == null || value.isBlank() ? defaultRole : BackendRole.fromLabel(value);
    }
}
