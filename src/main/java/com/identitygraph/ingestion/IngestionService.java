package com.identitygraph.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identitygraph.common.exception.EventNotFoundException;
import com.identitygraph.common.exception.IdentityGraphException;
import com.identitygraph.event.IngestionEvent;
import com.identitygraph.event.SourceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

/**
 * Service for accepting identity signals.
 *
 * Ingestion flow:
 * 1. Resolve the user (explicit id or the configured default)
 * 2. Serialize the payload and compute its checksum
 * 3. Store the ingestion record
 * 4. Publish the event to the queue
 *
 * A failed publish is logged and does not fail the ingestion; the stored
 * record is what gets replayed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    public static final int MAX_LISTED_EVENTS = 100;

    private final IngestionRecordRepository recordRepository;
    private final IngestionEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    @Value("${identity-graph.default-user-id:a0eebc99-9c0b-4ef8-bb6d-6bb9bd380a11}")
    private String defaultUserId;

    public IngestionRecord ingest(String userId, SourceType sourceType, JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("Payload must be a JSON object");
        }

        String resolvedUserId = resolveUserId(userId);
        String eventId = UUID.randomUUID().toString();
        Instant now = Instant.now();

        String rawPayload = serialize(payload);
        IngestionRecord record = new IngestionRecord(
            eventId, resolvedUserId, sourceType, rawPayload, checksum(rawPayload), now);
        recordRepository.save(record);

        IngestionEvent event = IngestionEvent.builder()
            .eventId(eventId)
            .userId(resolvedUserId)
            .sourceType(sourceType.name())
            .payload(payload)
            .timestamp(now)
            .build();

        try {
            eventPublisher.publish(event);
        } catch (AmqpException e) {
            log.error("Failed to publish event {}, stored for replay", eventId, e);
        }

        log.info("Event ingested: eventId={}, userId={}, sourceType={}", eventId, resolvedUserId, sourceType);
        return record;
    }

    public IngestionRecord getEvent(String eventId) {
        return recordRepository.findById(eventId)
            .orElseThrow(() -> new EventNotFoundException(eventId));
    }

    /**
     * List a user's most recent events, newest first.
     */
    public List<IngestionRecord> listEvents(String userId) {
        return recordRepository.findByUserIdOrderByCreatedAtDesc(
            resolveUserId(userId), PageRequest.of(0, MAX_LISTED_EVENTS));
    }

    private String resolveUserId(String userId) {
        return userId == null || userId.isBlank() ? defaultUserId : userId;
    }

    private String serialize(JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IdentityGraphException("Failed to serialize payload", e);
        }
    }

    static String checksum(String rawPayload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(rawPayload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
