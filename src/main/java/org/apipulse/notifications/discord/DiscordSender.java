package org.apipulse.notifications.discord;

import org.apipulse.model.ExecutionLog;
import org.apipulse.model.Integration;
import org.apipulse.model.IntegrationType;
import org.apipulse.model.NotificationLink;
import org.apipulse.model.Task;
import org.apipulse.notifications.ChannelDeliveryException;
import org.apipulse.notifications.JsonPostClient;
import org.apipulse.notifications.NotificationSender;
import org.apipulse.notifications.format.DiscordFormatter;
import org.apipulse.notifications.format.WebhookMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public class DiscordSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(DiscordSender.class);

    private final JsonPostClient client;

    public DiscordSender(JsonPostClient client) {
        this.client = client;
    }

    @Override
    public void send(NotificationLink link, Task task, ExecutionLog log) throws ChannelDeliveryException {
        String url = link.integration().credential(Integration.WEBHOOK_URL);
        if (url == null) {
            throw new ChannelDeliveryException(IntegrationType.DISCORD, "Integration has no webhook_url");
        }
        WebhookMessage message = DiscordFormatter.format(url, task, log, link.includeResponse());
        client.post(IntegrationType.DISCORD, message.url(), message.payload(), Map.of());
        logger.info("Discord notification sent for task {} via integration '{}'", task.id(), link.integration().name());
    }
}
