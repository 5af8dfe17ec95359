package org.apipulse.model;

import java.util.UUID;

/**
 * Binds a task to an integration, joined with that integration.
 * At most one link exists per (task, integration) pair.
 */
public record NotificationLink(
        UUID id,
        UUID taskId,
        Integration integration,
        NotifyOn notifyOn,
        boolean includeResponse
) {

    public boolean appliesTo(ExecutionLog log) {
        return integration != null && integration.active() && notifyOn.matches(log);
    }
}
