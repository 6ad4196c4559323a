package com.identitygraph.messaging;

import com.rabbitmq.client.GetResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Synchronously pulls waiting events off the queue, for manual replay and
 * testing without a running listener.
 */
@Service
@Slf4j
public class PendingEventDrainer {

    public static final int DEFAULT_MAX_MESSAGES = 100;

    private final RabbitTemplate rabbitTemplate;
    private final EventDeliveryHandler deliveryHandler;
    private final String queueName;

    public PendingEventDrainer(
            RabbitTemplate rabbitTemplate,
            EventDeliveryHandler deliveryHandler,
            @Value("${identity-graph.rabbitmq.queue:graph.engine.queue}") String queueName) {
        this.rabbitTemplate = rabbitTemplate;
        this.deliveryHandler = deliveryHandler;
        this.queueName = queueName;
    }

    /**
     * Process up to {@code maxMessages} waiting events.
     *
     * Stops at the first empty poll, requeued message or broker error. A
     * requeued message goes back to the head of the queue, so polling again
     * would only fetch it a second time.
     *
     * @return number of messages handled
     */
    public int processPending(int maxMessages) {
        int processed = 0;

        for (int i = 0; i < maxMessages; i++) {
            DeliveryOutcome outcome;
            try {
                outcome = rabbitTemplate.execute(channel -> {
                    GetResponse response = channel.basicGet(queueName, false);
                    if (response == null) {
                        return null;
                    }
                    DeliveryOutcome result = deliveryHandler.handle(response.getBody());
                    result.apply(channel, response.getEnvelope().getDeliveryTag());
                    return result;
                });
            } catch (AmqpException e) {
                log.error("Error draining queue {}", queueName, e);
                break;
            }

            if (outcome == null) {
                break;
            }
            processed++;
            if (outcome == DeliveryOutcome.REQUEUE) {
                log.warn("Message requeued, stopping drain of {}", queueName);
                break;
            }
        }

        log.info("Processed {} pending events from {}", processed, queueName);
        return processed;
    }
}
