package com.identitygraph.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.identitygraph.event.EventProcessor;
import com.identitygraph.event.IngestionEvent;
import com.identitygraph.graph.memory.InMemoryGraphStore;
import com.identitygraph.ingestion.IngestionEventPublisher;
import com.identitygraph.messaging.PendingEventDrainer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for the REST API.
 *
 * Runs against the in-memory graph store and H2; the broker is mocked.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class IdentityGraphApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private InMemoryGraphStore graphStore;

    @Autowired
    private EventProcessor eventProcessor;

    @MockBean
    private IngestionEventPublisher eventPublisher;

    @MockBean
    private PendingEventDrainer pendingEventDrainer;

    @MockBean
    private ConnectionFactory connectionFactory;

    @BeforeEach
    void setUp() {
        graphStore.reset();
    }

    @Test
    void testIngestAndGetEvent() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/ingest")
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"source_type": "VC", "payload": {"credentialSubject": {"email": "alice@example.com"}}}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("accepted"))
            .andExpect(jsonPath("$.event_id").isNotEmpty())
            .andExpect(jsonPath("$.created_at").isNotEmpty())
            .andReturn();

        String eventId = objectMapper.readTree(result.getResponse().getContentAsString()).get("event_id").asText();

        mockMvc.perform(get("/api/v1/events/{eventId}", eventId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.user_id").value("alice"))
            .andExpect(jsonPath("$.source_type").value("VC"))
            .andExpect(jsonPath("$.raw_payload.credentialSubject.email").value("alice@example.com"));

        mockMvc.perform(get("/api/v1/events").header("X-User-Id", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.events", hasSize(1)));

        verify(eventPublisher).publish(any(IngestionEvent.class));
    }

    @Test
    void testIngest_InvalidRequests() throws Exception {
        mockMvc.perform(post("/api/v1/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source_type\": \"SAML\", \"payload\": {}}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source_type\": \"VC\"}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source_type\": \"VC\", \"payload\": [1, 2]}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(eventPublisher);
    }

    @Test
    void testGetEvent_NotFound() throws Exception {
        mockMvc.perform(get("/api/v1/events/{eventId}", "missing-event"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value("404"))
            .andExpect(jsonPath("$.error").value("Event not found: missing-event"));
    }

    @Test
    void testUserGraphAndConflicts() throws Exception {
        process("event-1", "{\"credentialSubject\": {\"name\": \"Alice Smith\"}}");
        process("event-2", "{\"credentialSubject\": {\"name\": \"Alicia Smith\"}}");

        mockMvc.perform(get("/api/v1/users/{userId}/graph", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.nodeCount").value(5))
            .andExpect(jsonPath("$.edgeCount").value(5));

        mockMvc.perform(get("/api/v1/users/{userId}/conflicts", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].attribute").value("name"))
            .andExpect(jsonPath("$[0].claimAValue").value("Alicia Smith"))
            .andExpect(jsonPath("$[0].claimBValue").value("Alice Smith"));

        mockMvc.perform(get("/api/v1/users/{userId}/graph", "nobody"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.nodeCount").value(0));
    }

    @Test
    void testGetNode() throws Exception {
        process("event-1", "{\"credentialSubject\": {\"name\": \"Alice Smith\"}}");

        mockMvc.perform(get("/api/v1/nodes/{nodeId}", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.nodeType").value("User"));

        mockMvc.perform(get("/api/v1/nodes/{nodeId}", "missing-node"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Node not found: missing-node"));
    }

    @Test
    void testResolveConflict() throws Exception {
        mockMvc.perform(post("/api/v1/conflicts/{conflictId}/resolve", "edge-1")
                .param("preferredClaimId", "claim-a"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.persisted").value(false));

        mockMvc.perform(post("/api/v1/conflicts/{conflictId}/resolve", "edge-1"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testProcessPendingEvents() throws Exception {
        when(pendingEventDrainer.processPending(100)).thenReturn(3);

        mockMvc.perform(post("/api/v1/events/process"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(3));

        mockMvc.perform(post("/api/v1/events/process").param("maxMessages", "0"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testHealthAndReadiness() throws Exception {
        Connection connection = mock(Connection.class);
        when(connection.isOpen()).thenReturn(true);
        when(connectionFactory.createConnection()).thenReturn(connection);

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.service").value("identity-graph-engine"));

        mockMvc.perform(get("/ready"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ready").value(true))
            .andExpect(jsonPath("$.graph_store").value("InMemory"))
            .andExpect(jsonPath("$.graph_store_healthy").value(true))
            .andExpect(jsonPath("$.neo4j").doesNotExist());

        graphStore.setHealthy(false);

        mockMvc.perform(get("/ready"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.ready").value(false))
            .andExpect(jsonPath("$.graph_store_healthy").value(false))
            .andExpect(jsonPath("$.graph_store").value("InMemory"));
    }

    private void process(String eventId, String payload) throws Exception {
        eventProcessor.process(IngestionEvent.builder()
            .eventId(eventId)
            .userId("alice")
            .sourceType("VC")
            .payload(objectMapper.readTree(payload))
            .timestamp(Instant.now())
            .build());
    }
}
