package com.identitygraph.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identitygraph.event.EventProcessor;
import com.identitygraph.event.IngestionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Turns a raw queue message into a delivery outcome.
 *
 * Outcomes:
 * - Body is not a readable event (bad JSON, bad timestamp, no user id) → REJECT
 * - Processing throws (e.g. graph store unavailable) → REQUEUE
 * - Otherwise, including skipped source types → ACK
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventDeliveryHandler {

    private final ObjectMapper objectMapper;
    private final EventProcessor eventProcessor;

    public DeliveryOutcome handle(byte[] body) {
        IngestionEvent event;
        try {
            event = objectMapper.readValue(body, IngestionEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Invalid message body, rejecting: {}", e.getOriginalMessage());
            return DeliveryOutcome.REJECT;
        } catch (IOException e) {
            log.error("Unreadable message body, rejecting", e);
            return DeliveryOutcome.REJECT;
        }

        if (event == null) {
            log.error("Empty message body, rejecting");
            return DeliveryOutcome.REJECT;
        }

        if (event.getUserId() == null || event.getUserId().isBlank()) {
            log.error("Event {} has no user id, rejecting", event.getEventId());
            return DeliveryOutcome.REJECT;
        }

        try {
            eventProcessor.process(event);
            log.debug("Message acknowledged: {}", event.getEventId());
            return DeliveryOutcome.ACK;
        } catch (RuntimeException e) {
            log.error("Error processing event {}, requeueing", event.getEventId(), e);
            return DeliveryOutcome.REQUEUE;
        }
    }
}
