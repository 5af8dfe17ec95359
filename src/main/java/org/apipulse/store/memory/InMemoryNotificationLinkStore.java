package org.apipulse.store.memory;

import org.apipulse.model.Integration;
import org.apipulse.model.NotificationLink;
import org.apipulse.model.NotifyOn;
import org.apipulse.store.NotificationLinkStore;
import org.apipulse.store.PersistenceException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryNotificationLinkStore implements NotificationLinkStore {

    private final Map<UUID, Integration> integrations = new ConcurrentHashMap<>();
    // keyed by task id + integration id, which keeps links unique per pair
    private final Map<String, NotificationLink> links = new ConcurrentHashMap<>();

    public Integration saveIntegration(Integration integration) {
        integrations.put(integration.id(), integration);
        return integration;
    }

    @Override
    public List<NotificationLink> findByTask(UUID taskId) {
        return links.values().stream()
                .filter(l -> l.taskId().equals(taskId))
                .map(l -> new NotificationLink(l.id(), l.taskId(),
                        integrations.get(l.integration().id()), l.notifyOn(), l.includeResponse()))
                .toList();
    }

    @Override
    public Optional<Integration> findIntegration(UUID integrationId) {
        return Optional.ofNullable(integrations.get(integrationId));
    }

    @Override
    public NotificationLink upsert(UUID taskId, UUID integrationId, NotifyOn notifyOn, boolean includeResponse) {
        Integration integration = integrations.get(integrationId);
        if (integration == null) {
            throw new PersistenceException("Integration " + integrationId + " does not exist");
        }
        return links.compute(key(taskId, integrationId), (k, existing) -> new NotificationLink(
                existing != null ? existing.id() : UUID.randomUUID(),
                taskId, integration, notifyOn, includeResponse));
    }

    public void deleteByTask(UUID taskId) {
        links.values().removeIf(l -> l.taskId().equals(taskId));
    }

    private static String key(UUID taskId, UUID integrationId) {
        return taskId + ":" + integrationId;
    }
}
