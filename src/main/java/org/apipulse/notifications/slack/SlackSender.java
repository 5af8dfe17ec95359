package org.apipulse.notifications.slack;

import org.apipulse.model.ExecutionLog;
import org.apipulse.model.Integration;
import org.apipulse.model.IntegrationType;
import org.apipulse.model.NotificationLink;
import org.apipulse.model.Task;
import org.apipulse.notifications.ChannelDeliveryException;
import org.apipulse.notifications.JsonPostClient;
import org.apipulse.notifications.NotificationSender;
import org.apipulse.notifications.format.SlackFormatter;
import org.apipulse.notifications.format.WebhookMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Sends execution results to a Slack incoming webhook.
 */
public class SlackSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(SlackSender.class);

    private final JsonPostClient client;

    public SlackSender(JsonPostClient client) {
        this.client = client;
    }

    @Override
    public void send(NotificationLink link, Task task, ExecutionLog log) throws ChannelDeliveryException {
        String url = link.integration().credential(Integration.WEBHOOK_URL);
        if (url == null) {
            throw new ChannelDeliveryException(IntegrationType.SLACK, "Integration has no webhook_url");
        }
        WebhookMessage message = SlackFormatter.format(url, task, log, link.includeResponse());
        client.post(IntegrationType.SLACK, message.url(), message.payload(), Map.of());
        logger.info("Slack notification sent for task {} via integration '{}'", task.id(), link.integration().name());
    }
}
