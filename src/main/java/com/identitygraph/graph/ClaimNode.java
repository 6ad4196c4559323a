package com.identitygraph.graph;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An atomic identity claim, e.g. {@code name = John Doe}.
 *
 * Claims are immutable once created. A claim superseded by a newer credential
 * is linked to it through a CONTRADICTS edge, never overwritten.
 */
@Value
public class ClaimNode {

    String nodeId;

    /**
     * Dot-joined attribute path, e.g. {@code degree.type}.
     */
    String attribute;

    /**
     * Stringified value; null when the credential carried an explicit null.
     */
    String value;

    double confidence;

    Instant createdAt;

    public static ClaimNode of(String attribute, String value, double confidence) {
        return new ClaimNode(UUID.randomUUID().toString(), attribute, value, confidence, Instant.now());
    }
}
