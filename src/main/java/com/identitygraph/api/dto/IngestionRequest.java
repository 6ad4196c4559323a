package com.identitygraph.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.identitygraph.event.SourceType;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for ingesting an identity signal.
 */
@Data
public class IngestionRequest {

    @NotNull(message = "Source type is required")
    @JsonProperty("source_type")
    private SourceType sourceType;

    @NotNull(message = "Payload is required")
    @JsonProperty("payload")
    private JsonNode payload;
}
