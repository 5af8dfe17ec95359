package org.apipulse.notifications;

import org.apipulse.model.IntegrationType;

/**
 * A notification could not be delivered on one channel. Never retried.
 */
public class ChannelDeliveryException extends Exception {

    private final IntegrationType channel;

    public ChannelDeliveryException(IntegrationType channel, String message) {
        super(message);
        this.channel = channel;
    }

    public ChannelDeliveryException(IntegrationType channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public IntegrationType channel() {
        return channel;
    }
}
