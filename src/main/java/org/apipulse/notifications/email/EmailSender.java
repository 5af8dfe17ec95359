package org.apipulse.notifications.email;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apipulse.config.XmlConfiguration;
import org.apipulse.model.ExecutionLog;
import org.apipulse.model.Integration;
import org.apipulse.model.IntegrationType;
import org.apipulse.model.NotificationLink;
import org.apipulse.model.Task;
import org.apipulse.notifications.ChannelDeliveryException;
import org.apipulse.notifications.JsonPostClient;
import org.apipulse.notifications.NotificationSender;
import org.apipulse.notifications.format.EmailContent;
import org.apipulse.notifications.format.EmailFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Sends HTML email through a transactional email HTTP API authenticated with a bearer key.
 */
public class EmailSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(EmailSender.class);

    private final XmlConfiguration.Notification.Email config;
    private final EmailFormatter formatter;
    private final JsonPostClient client;

    public EmailSender(XmlConfiguration.Notification.Email config, EmailFormatter formatter, JsonPostClient client) {
        this.config = config;
        this.formatter = formatter;
        this.client = client;
        logger.info("[---------- EmailSender initialized for API {} ----------]", config.apiUrl);
    }

    @Override
    public void send(NotificationLink link, Task task, ExecutionLog log) throws ChannelDeliveryException {
        String recipient = link.integration().credential(Integration.EMAIL);
        if (recipient == null) {
            throw new ChannelDeliveryException(IntegrationType.EMAIL, "Integration has no email address");
        }
        if (config.apiKey == null || config.apiKey.isBlank()) {
            throw new ChannelDeliveryException(IntegrationType.EMAIL, "Email API key is not configured");
        }

        EmailContent content = formatter.format(recipient, task, log, link.includeResponse());

        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("from", fromHeader());
        body.putArray("to").add(content.to());
        body.put("subject", content.subject());
        body.put("html", content.html());

        client.post(IntegrationType.EMAIL, config.apiUrl, body, Map.of("Authorization", "Bearer " + config.apiKey));
        logger.info("Email notification sent for task {} to {}", task.id(), recipient);
    }

    private String fromHeader() {
        if (config.fromName == null || config.fromName.isBlank()) return config.fromAddress;
        return config.fromName + " <" + config.fromAddress + ">";
    }
}
