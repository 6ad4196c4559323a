package com.identitygraph.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.identitygraph.conflict.ConflictDetector;
import com.identitygraph.decomposition.ClaimExtractor;
import com.identitygraph.decomposition.CredentialDecomposer;
import com.identitygraph.decomposition.DecompositionResult;
import com.identitygraph.graph.EdgeType;
import com.identitygraph.graph.NodeType;
import com.identitygraph.graph.memory.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the event flow from payload to graph, against the in-memory graph store.
 */
class EventProcessorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private InMemoryGraphStore graphStore;
    private EventProcessor processor;

    @BeforeEach
    void setUp() {
        graphStore = new InMemoryGraphStore();
        processor = new EventProcessor(
            new CredentialDecomposer(graphStore, new ClaimExtractor()),
            new ConflictDetector(graphStore));
    }

    @Test
    void testProcess_VcEventsDetectConflicts() throws Exception {
        processor.process(event("VC", """
            {"issuer": "did:example:gov", "credentialSubject": {"name": "Alice Smith", "email": "alice@example.com"}}
            """));
        Optional<DecompositionResult> second = processor.process(event("VC", """
            {"issuer": "did:example:bank", "credentialSubject": {"name": "Alicia Smith", "email": "alice@example.com"}}
            """));

        assertTrue(second.isPresent());
        assertEquals(2, second.get().getClaimNodes().size());
        assertEquals(1, second.get().getConflictsDetected());
        assertEquals(1, graphStore.countEdges(EdgeType.CONTRADICTS));
        assertEquals("name", graphStore.getConflicts("alice").get(0).getAttribute());
    }

    @Test
    void testProcess_OidcEventIsNormalized() throws Exception {
        Optional<DecompositionResult> result = processor.process(event("OIDC", """
            {"iss": "https://accounts.example.com", "sub": "1234567890", "email": "alice@example.com", "name": "Alice"}
            """));

        assertTrue(result.isPresent());
        assertEquals("OIDCCredential", result.get().getCredentialNode().getCredentialType());
        assertEquals("https://accounts.example.com", result.get().getCredentialNode().getIssuer());
        assertEquals(2, result.get().getClaimNodes().size());
    }

    @Test
    void testProcess_OidcConflictsWithVc() throws Exception {
        processor.process(event("VC", """
            {"credentialSubject": {"email": "alice@example.com"}}
            """));
        Optional<DecompositionResult> result = processor.process(event("OIDC", """
            {"sub": "1234567890", "email": "alice@work.example.com"}
            """));

        assertEquals(1, result.orElseThrow().getConflictsDetected());
    }

    @Test
    void testProcess_ManualAndUnknownAreSkipped() throws Exception {
        assertTrue(processor.process(event("MANUAL", "{\"name\": \"Alice\"}")).isEmpty());
        assertTrue(processor.process(event("SAML", "{\"name\": \"Alice\"}")).isEmpty());

        assertEquals(0, graphStore.countNodes(NodeType.USER));
    }

    private IngestionEvent event(String sourceType, String payload) throws Exception {
        return IngestionEvent.builder()
            .eventId("event-" + sourceType)
            .userId("alice")
            .sourceType(sourceType)
            .payload(objectMapper.readTree(payload))
            .timestamp(Instant.now())
            .build();
    }
}
