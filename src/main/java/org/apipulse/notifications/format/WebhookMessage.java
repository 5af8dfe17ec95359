package org.apipulse.notifications.format;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A JSON document and the URL it is to be POSTed to.
 */
public record WebhookMessage(String url, JsonNode payload) {
}
