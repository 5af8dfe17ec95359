package org.apipulse.store;

/**
 * A store read or write failed. Carries the underlying driver exception as cause.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public PersistenceException(String message) {
        super(message);
    }
}
