package org.apipulse.model;

import java.util.Locale;

/**
 * HTTP methods a task may use against its target.
 */
public enum HttpMethod {
    GET,
    POST;

    public static HttpMethod fromString(String value) {
        if (value == null || value.isBlank()) {
            return GET;
        }
        try {
            return HttpMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + value + ". Use GET or POST");
        }
    }
}
