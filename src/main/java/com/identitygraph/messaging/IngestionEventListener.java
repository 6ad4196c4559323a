package com.identitygraph.messaging;

import com.rabbitmq.client.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Consumes ingestion events from the graph engine queue with manual
 * acknowledgment.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestionEventListener {

    private final EventDeliveryHandler deliveryHandler;

    @RabbitListener(queues = "${identity-graph.rabbitmq.queue:graph.engine.queue}", ackMode = "MANUAL")
    public void onMessage(Message message, Channel channel) throws IOException {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();
        DeliveryOutcome outcome = deliveryHandler.handle(message.getBody());
        outcome.apply(channel, deliveryTag);
        log.debug("Delivery {} settled as {}", deliveryTag, outcome);
    }
}
