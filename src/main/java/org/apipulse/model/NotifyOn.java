package org.apipulse.model;

import java.util.Locale;

/**
 * When a notification link fires for an execution.
 */
public enum NotifyOn {

    /** Every execution. */
    ALWAYS {
        @Override
        public boolean matches(ExecutionLog log) {
            return true;
        }
    },

    /** Transport failure or an HTTP status of 400 and above. */
    FAILURE_ONLY {
        @Override
        public boolean matches(ExecutionLog log) {
            return log.statusCode() == null || log.statusCode() >= 400;
        }
    },

    /** Only when the execution recorded an error message, whatever the status code. */
    TIMEOUT {
        @Override
        public boolean matches(ExecutionLog log) {
            return log.errorMessage() != null;
        }
    };

    public abstract boolean matches(ExecutionLog log);

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static NotifyOn fromCode(String code) {
        if (code == null || code.isBlank()) {
            return ALWAYS;
        }
        try {
            return NotifyOn.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown notify_on policy: " + code
                    + ". Use always, failure_only or timeout");
        }
    }
}
