package com.identitygraph.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO returned once an identity signal has been accepted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResponse {

    public static final String STATUS_ACCEPTED = "accepted";

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("status")
    private String status;

    @JsonProperty("message")
    private String message;

    @JsonProperty("created_at")
    private Instant createdAt;
}
