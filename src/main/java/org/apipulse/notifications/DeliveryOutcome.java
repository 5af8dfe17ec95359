package org.apipulse.notifications;

import org.apipulse.model.IntegrationType;

import java.util.UUID;

/**
 * Result of one channel delivery attempt.
 *
 * @param error null when delivered
 */
public record DeliveryOutcome(UUID integrationId, IntegrationType channel, boolean delivered, String error) {

    public static DeliveryOutcome delivered(UUID integrationId, IntegrationType channel) {
        return new DeliveryOutcome(integrationId, channel, true, null);
    }

    public static DeliveryOutcome failed(UUID integrationId, IntegrationType channel, String error) {
        return new DeliveryOutcome(integrationId, channel, false, error);
    }
}
