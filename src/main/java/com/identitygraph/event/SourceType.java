package com.identitygraph.event;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of identity signal carried by an ingestion event.
 */
public enum SourceType {
    /**
     * W3C Verifiable Credential document
     */
    VC,

    /**
     * Decoded OIDC ID token claims
     */
    OIDC,

    /**
     * Manually entered attributes; accepted at ingestion, not decomposed
     */
    MANUAL;

    /**
     * Look up a source type by its wire value.
     *
     * @return the matching type, or empty for unknown values
     */
    public static Optional<SourceType> fromValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.name().equals(value))
            .findFirst();
    }
}
