package com.identitygraph.api.controller;

import com.identitygraph.api.dto.EventListResponse;
import com.identitygraph.api.dto.IngestionRequest;
import com.identitygraph.api.dto.IngestionResponse;
import com.identitygraph.ingestion.IngestionRecord;
import com.identitygraph.ingestion.IngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for ingesting identity signals and reading the ingestion audit log.
 *
 * The acting user comes from the {@code X-User-Id} header; without it the
 * configured default user is used.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Ingestion", description = "Identity signal ingestion API")
public class IngestionController {

    public static final String USER_HEADER = "X-User-Id";

    private final IngestionService ingestionService;

    @PostMapping("/ingest")
    @Operation(summary = "Ingest a credential or token")
    public ResponseEntity<IngestionResponse> ingest(
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @Valid @RequestBody IngestionRequest request) {
        IngestionRecord record = ingestionService.ingest(userId, request.getSourceType(), request.getPayload());
        IngestionResponse response = new IngestionResponse(
            record.getEventId(),
            IngestionResponse.STATUS_ACCEPTED,
            "Credential ingested successfully",
            record.getCreatedAt()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/events/{eventId}")
    @Operation(summary = "Get an ingestion event")
    public ResponseEntity<IngestionRecord> getEvent(@PathVariable String eventId) {
        return ResponseEntity.ok(ingestionService.getEvent(eventId));
    }

    @GetMapping("/events")
    @Operation(summary = "List the user's most recent ingestion events")
    public ResponseEntity<EventListResponse> listEvents(
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        List<IngestionRecord> events = ingestionService.listEvents(userId);
        return ResponseEntity.ok(new EventListResponse(events, events.size()));
    }
}
