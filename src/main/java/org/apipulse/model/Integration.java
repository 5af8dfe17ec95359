package org.apipulse.model;

import java.util.Map;
import java.util.UUID;

/**
 * A configured notification endpoint owned by a user.
 *
 * @param credentials opaque channel settings, {@code webhook_url} or {@code email}
 */
public record Integration(
        UUID id,
        UUID userId,
        IntegrationType type,
        String name,
        Map<String, String> credentials,
        boolean active
) {

    public static final String WEBHOOK_URL = "webhook_url";
    public static final String EMAIL = "email";

    public Integration {
        credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
    }

    public String credential(String key) {
        String value = credentials.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
