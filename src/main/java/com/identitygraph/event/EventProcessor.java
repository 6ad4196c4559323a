package com.identitygraph.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.identitygraph.conflict.Conflict;
import com.identitygraph.conflict.ConflictDetector;
import com.identitygraph.credential.VerifiableCredential;
import com.identitygraph.decomposition.CredentialDecomposer;
import com.identitygraph.decomposition.DecompositionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Routes an ingestion event to decomposition and conflict detection.
 *
 * VC payloads are decomposed directly, OIDC payloads are first normalized into
 * a credential document. Other source types are skipped with a warning.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventProcessor {

    private final CredentialDecomposer credentialDecomposer;
    private final ConflictDetector conflictDetector;

    /**
     * Process one event.
     *
     * @return the decomposition result, or empty if the event was skipped
     */
    public Optional<DecompositionResult> process(IngestionEvent event) {
        log.info("Processing event {} (type: {}, user: {})",
            event.getEventId(), event.getSourceType(), event.getUserId());

        Optional<SourceType> sourceType = SourceType.fromValue(event.getSourceType());
        if (sourceType.isEmpty()) {
            log.warn("Unknown source type {} for event {}, skipping", event.getSourceType(), event.getEventId());
            return Optional.empty();
        }

        JsonNode payload = event.getPayload() == null ? JsonNodeFactory.instance.objectNode() : event.getPayload();

        return switch (sourceType.get()) {
            case VC -> Optional.of(processCredential(event, payload));
            case OIDC -> Optional.of(processCredential(event, OidcNormalizer.toCredentialDocument(payload)));
            case MANUAL -> {
                log.warn("Manual events are not decomposed, skipping event {}", event.getEventId());
                yield Optional.empty();
            }
        };
    }

    private DecompositionResult processCredential(IngestionEvent event, JsonNode document) {
        VerifiableCredential credential = VerifiableCredential.fromJson(document);

        log.info("Processing credential: type={}, issuer={}",
            credential.getCredentialType(), credential.getIssuerId());

        DecompositionResult result = credentialDecomposer.decompose(
            credential, event.getUserId(), event.getEventId());

        List<Conflict> conflicts = conflictDetector.detectConflicts(event.getUserId(), result.getClaimNodes());
        result.setConflictsDetected(conflicts.size());

        log.info("Event {} processed: {} claims, {} edges, {} conflicts",
            event.getEventId(), result.getClaimNodes().size(), result.getEdgesCreated(), conflicts.size());

        return result;
    }
}
