package org.apipulse.scheduling;

/**
 * Raised when a schedule string is not a positive count followed by m, h or d.
 */
public class InvalidIntervalException extends IllegalArgumentException {

    private final String expression;

    public InvalidIntervalException(String expression, String message) {
        super(message);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
