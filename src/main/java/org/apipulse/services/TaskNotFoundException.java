package org.apipulse.services;

import java.util.UUID;

/**
 * No task or integration with the given id is visible to the caller.
 */
public class TaskNotFoundException extends RuntimeException {

    public TaskNotFoundException(String what, UUID id) {
        super(what + " not found: " + id);
    }
}
