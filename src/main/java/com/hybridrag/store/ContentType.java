package com.hybridrag.store;

import java.util.Locale;

public enum ContentType {
    TEXT,
    LIST,
    TABLE,
    CODE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ContentType fromLabel(Object label) {
        if (label == null) {
            return TEXT;
        }
        try {
            return valueOf(label.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return TEXT;
        }
    }
}
