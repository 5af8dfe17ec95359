package org.apipulse.notifications;

import org.apipulse.model.ExecutionLog;
import org.apipulse.model.NotificationLink;
import org.apipulse.model.Task;

public interface NotificationSender {
    /**
     * Delivers one execution result through the link's integration.
     *
     * @param link  the matched link, carrying the integration credentials and the include-response flag
     * @param task  the executed task
     * @param log   the persisted execution log
     * @throws ChannelDeliveryException when the channel rejects the message or cannot be reached
     */
    void send(NotificationLink link, Task task, ExecutionLog log) throws ChannelDeliveryException;
}
