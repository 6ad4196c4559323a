package com.identitygraph.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Queue message announcing an ingested identity signal.
 *
 * The source type is kept as the raw wire string so that consumers can skip
 * types they do not know instead of failing to read the message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IngestionEvent {

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("source_type")
    private String sourceType;

    @JsonProperty("payload")
    private JsonNode payload;

    @JsonProperty("timestamp")
    private Instant timestamp;
}
