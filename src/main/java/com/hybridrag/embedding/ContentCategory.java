package com.hybridrag.embedding;

import java.util.Locale;

import com.hybridrag.error.ValidationException;

public enum ContentCategory {
    DOC("doc"),
    CODE("code");

    private final String label;

    ContentCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ContentCategory fromLabel(String label) {
        if (label == null) {
            return DOC;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (ContentCategory category : values()) {
            if (category.label.equals(normalized)) {
                return category;
            }
        }
        throw new ValidationException("Invalid content category: " + label + ". Must be 'doc' or 'code'.");
    }
}
