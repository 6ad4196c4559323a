package com.identitygraph.graph;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Graph node representing one decomposed credential.
 */
@Value
@Builder
public class CredentialNode {

    @Builder.Default
    String nodeId = UUID.randomUUID().toString();

    String issuer;

    String issuerName;

    String credentialType;

    OffsetDateTime issuanceDate;

    /**
     * Ingestion event this credential was decomposed from.
     */
    String eventId;

    @Builder.Default
    Instant createdAt = Instant.now();
}
