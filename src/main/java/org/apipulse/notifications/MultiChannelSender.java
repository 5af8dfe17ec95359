package org.apipulse.notifications;

import org.apipulse.model.ExecutionLog;
import org.apipulse.model.IntegrationType;
import org.apipulse.model.NotificationLink;
import org.apipulse.model.Task;

import java.util.EnumMap;
import java.util.Map;

/**
 * Routes a link to the sender registered for its integration type.
 */
public class MultiChannelSender implements NotificationSender {

    private final Map<IntegrationType, NotificationSender> senders = new EnumMap<>(IntegrationType.class);

    public MultiChannelSender addSender(IntegrationType type, NotificationSender sender) {
        senders.put(type, sender);
        return this;
    }

    @Override
    public void send(NotificationLink link, Task task, ExecutionLog log) throws ChannelDeliveryException {
        IntegrationType type = link.integration().type();
        NotificationSender sender = senders.get(type);
        if (sender == null) {
            throw new ChannelDeliveryException(type, "No sender registered for channel " + type.code());
        }
        sender.send(link, task, log);
    }
}
