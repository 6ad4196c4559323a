package com.identitygraph.ingestion;

import com.identitygraph.event.IngestionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Publishes ingestion events to the identity events exchange as JSON.
 */
@Component
@Slf4j
public class IngestionEventPublisher {

    private final RabbitTemplate rabbitTemplate;
    private final String exchange;
    private final String routingKey;

    public IngestionEventPublisher(
            RabbitTemplate rabbitTemplate,
            @Value("${identity-graph.rabbitmq.exchange:identity.events}") String exchange,
            @Value("${identity-graph.rabbitmq.routing-key:identity.new}") String routingKey) {
        this.rabbitTemplate = rabbitTemplate;
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    /**
     * @throws org.springframework.amqp.AmqpException if the broker rejects or cannot take the message
     */
    public void publish(IngestionEvent event) {
        rabbitTemplate.convertAndSend(exchange, routingKey, event);
        log.debug("Published event {} to {} ({})", event.getEventId(), exchange, routingKey);
    }
}
