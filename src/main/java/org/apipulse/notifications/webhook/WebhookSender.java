package org.apipulse.notifications.webhook;

import org.apipulse.model.ExecutionLog;
import org.apipulse.model.Integration;
import org.apipulse.model.IntegrationType;
import org.apipulse.model.NotificationLink;
import org.apipulse.model.Task;
import org.apipulse.notifications.ChannelDeliveryException;
import org.apipulse.notifications.JsonPostClient;
import org.apipulse.notifications.NotificationSender;
import org.apipulse.notifications.format.WebhookFormatter;
import org.apipulse.notifications.format.WebhookMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * POSTs the flat execution document to a user supplied URL.
 */
public class WebhookSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(WebhookSender.class);

    public static final String EVENT_HEADER = "X-ApiPulse-Event";

    private final JsonPostClient client;

    public WebhookSender(JsonPostClient client) {
        this.client = client;
    }

    @Override
    public void send(NotificationLink link, Task task, ExecutionLog log) throws ChannelDeliveryException {
        String url = link.integration().credential(Integration.WEBHOOK_URL);
        if (url == null) {
            throw new ChannelDeliveryException(IntegrationType.WEBHOOK, "Integration has no webhook_url");
        }
        WebhookMessage message = WebhookFormatter.format(url, task, log, link.includeResponse());
        client.post(IntegrationType.WEBHOOK, message.url(), message.payload(),
                Map.of(EVENT_HEADER, log.isSuccess() ? "task.succeeded" : "task.failed"));
        logger.info("Webhook notification sent for task {} to integration '{}'", task.id(), link.integration().name());
    }
}
