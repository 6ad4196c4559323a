package com.identitygraph.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.identitygraph.event.SourceType;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit record of one ingested identity signal.
 *
 * Records are append-only and are the source of truth for replaying events
 * that never reached the queue.
 */
@Entity
@Table(name = "ingestion_events", indexes = {
    @Index(name = "idx_ingestion_events_user_id", columnList = "user_id"),
    @Index(name = "idx_ingestion_events_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class IngestionRecord {

    @Id
    @Column(name = "event_id")
    @JsonProperty("event_id")
    private String eventId;

    @Column(name = "user_id", nullable = false)
    @JsonProperty("user_id")
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false)
    @JsonProperty("source_type")
    private SourceType sourceType;

    /**
     * Payload exactly as serialized at ingestion time.
     */
    @Column(name = "raw_payload", nullable = false, length = 1_000_000)
    @JsonProperty("raw_payload")
    @JsonRawValue
    private String rawPayload;

    /**
     * Lower-case hex SHA-256 of the raw payload's UTF-8 bytes.
     */
    @Column(name = "checksum", nullable = false, length = 64)
    @JsonProperty("checksum")
    private String checksum;

    @Column(name = "created_at", nullable = false)
    @JsonProperty("created_at")
    private Instant createdAt;

    public IngestionRecord(String eventId, String userId, SourceType sourceType,
                           String rawPayload, String checksum, Instant createdAt) {
        this.eventId = eventId;
        this.userId = userId;
        this.sourceType = sourceType;
        this.rawPayload = rawPayload;
        this.checksum = checksum;
        this.createdAt = createdAt;
    }
}
