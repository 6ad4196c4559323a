package com.identitygraph.messaging;

import com.rabbitmq.client.Channel;

import java.io.IOException;

/**
 * What to tell the broker about a delivered message.
 */
public enum DeliveryOutcome {
    /**
     * Processed (or deliberately skipped); remove from the queue
     */
    ACK,

    /**
     * Unreadable message; drop it without redelivery
     */
    REJECT,

    /**
     * Processing failed; return it to the queue for redelivery
     */
    REQUEUE;

    public void apply(Channel channel, long deliveryTag) throws IOException {
        switch (this) {
            case ACK -> channel.basicAck(deliveryTag, false);
            case REJECT -> channel.basicReject(deliveryTag, false);
            case REQUEUE -> channel.basicReject(deliveryTag, true);
        }
    }
}
