package org.apipulse.store;

import org.apipulse.model.Integration;
import org.apipulse.model.NotificationLink;
import org.apipulse.model.NotifyOn;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads notification links joined with their integration. Integrations themselves are managed elsewhere.
 */
public interface NotificationLinkStore {

    List<NotificationLink> findByTask(UUID taskId);

    Optional<Integration> findIntegration(UUID integrationId);

    /**
     * Creates the link or replaces the policy of the existing link for the same (task, integration) pair.
     */
    NotificationLink upsert(UUID taskId, UUID integrationId, NotifyOn notifyOn, boolean includeResponse);
}
