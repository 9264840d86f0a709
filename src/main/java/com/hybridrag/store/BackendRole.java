package com.hybridrag.store;

import java.util.Locale;

import com.hybridrag.error.ValidationException;

public enum BackendRole {
    PRIMARY("cloud"),
    SECONDARY("local");

    private final String label;

    BackendRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static BackendRole fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (BackendRole role : values()) {
                if (role.label.equals(normalized) || role.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return role;
                }
            }
        }
        throw new ValidationException("Invalid collection: " + label + ". Must be 'cloud' or 'local'");
    }
}
