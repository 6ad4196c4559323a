package com.identitygraph.decomposition;

import com.identitygraph.credential.VerifiableCredential;
import com.identitygraph.graph.ClaimNode;
import com.identitygraph.graph.CredentialNode;
import com.identitygraph.graph.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;

/**
 * Decomposes a verifiable credential into graph nodes.
 *
 * Decomposition flow:
 * 1. Upsert the user node
 * 2. Create the credential node, linked BELONGS_TO the user
 * 3. Extract claims from the credential subject (the subject's own {@code id} is skipped)
 * 4. Create one claim node and one SUPPORTS edge per claim
 *
 * Each step is a separate graph store call. A failure part-way through
 * propagates and leaves the nodes already written in place.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialDecomposer {

    private static final double DEFAULT_CONFIDENCE = 1.0;

    // The subject identifier is the user, not a claim about them
    private static final String SUBJECT_ID_PATH = "id";

    private final GraphStore graphStore;
    private final ClaimExtractor claimExtractor;

    public DecompositionResult decompose(VerifiableCredential credential, String userId, String eventId) {
        log.info("Decomposing credential {} of type {} for user {}",
            credential.getId(), credential.getCredentialType(), userId);

        graphStore.upsertUser(userId);

        CredentialNode credentialNode = CredentialNode.builder()
            .issuer(credential.getIssuerId())
            .issuerName(credential.getIssuerName().orElse(null))
            .credentialType(credential.getCredentialType())
            .issuanceDate(parseIssuanceDate(credential.getIssuanceDate()))
            .eventId(eventId)
            .build();
        graphStore.createCredentialNode(credentialNode, userId);

        List<ClaimNode> claimNodes = new ArrayList<>();
        int edgesCreated = 0;

        for (ExtractedClaim extracted : claimExtractor.extract(credential.getCredentialSubject())) {
            if (SUBJECT_ID_PATH.equals(extracted.getPath())) {
                continue;
            }

            ClaimNode claim = ClaimNode.of(extracted.getPath(), extracted.getStringValue(), DEFAULT_CONFIDENCE);
            graphStore.createClaimNode(claim);
            graphStore.createSupportsEdge(credentialNode.getNodeId(), claim.getNodeId());

            claimNodes.add(claim);
            edgesCreated++;
            log.debug("Created claim {} {}={}", claim.getNodeId(), claim.getAttribute(), claim.getValue());
        }

        log.info("Decomposed credential into {} claims for user {}", claimNodes.size(), userId);

        return DecompositionResult.builder()
            .credentialNode(credentialNode)
            .claimNodes(claimNodes)
            .edgesCreated(edgesCreated)
            .conflictsDetected(0)
            .build();
    }

    /**
     * Parse an ISO-8601 issuance date.
     *
     * Accepts a date-time with offset, a local date-time (taken as UTC) or a
     * plain date (start of day UTC).
     *
     * @return the parsed date, or null if absent or unparseable
     */
    static OffsetDateTime parseIssuanceDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(raw, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return (OffsetDateTime) parsed;
            }
            return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return parseDateOnly(raw);
        }
    }

    private static OffsetDateTime parseDateOnly(String raw) {
        try {
            return LocalDate.parse(raw).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.warn("Could not parse issuance date '{}', continuing without it", raw);
            return null;
        }
    }
}
