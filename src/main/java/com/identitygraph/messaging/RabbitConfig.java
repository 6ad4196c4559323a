package com.identitygraph.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.FanoutExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Queue topology for ingestion events.
 *
 * A durable fanout exchange delivers every event to the durable graph engine
 * queue; the routing key is carried for consumers bound by key.
 */
@Configuration
public class RabbitConfig {

    @Bean
    public FanoutExchange identityEventsExchange(
            @Value("${identity-graph.rabbitmq.exchange:identity.events}") String exchange) {
        return new FanoutExchange(exchange, true, false);
    }

    @Bean
    public Queue graphEngineQueue(
            @Value("${identity-graph.rabbitmq.queue:graph.engine.queue}") String queue) {
        return QueueBuilder.durable(queue).build();
    }

    @Bean
    public Binding graphEngineBinding(
            FanoutExchange identityEventsExchange,
            Queue graphEngineQueue,
            @Value("${identity-graph.rabbitmq.routing-key:identity.new}") String routingKey) {
        return new Binding(graphEngineQueue.getName(), Binding.DestinationType.QUEUE,
            identityEventsExchange.getName(), routingKey, null);
    }

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }
}
