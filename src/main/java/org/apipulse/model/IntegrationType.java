package org.apipulse.model;

import java.util.Locale;

/**
 * Notification channel kinds, persisted in lowercase.
 */
public enum IntegrationType {
    SLACK,
    DISCORD,
    EMAIL,
    WEBHOOK;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IntegrationType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Integration type is required");
        }
        try {
            return IntegrationType.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown integration type: " + code);
        }
    }
}
