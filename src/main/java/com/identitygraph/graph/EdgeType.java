package com.identitygraph.graph;

/**
 * Types of edges (relationships) in the identity graph.
 */
public enum EdgeType {
    /**
     * Credential -> Claim. One per claim, created at decomposition time.
     */
    SUPPORTS,

    /**
     * Claim -> Claim with the same attribute and a differing value.
     * Carries a confidence score. Treated as a log: never deduplicated.
     */
    CONTRADICTS,

    /**
     * Claim -> Credential.
     */
    DERIVED_FROM,

    /**
     * Fragment ~ Fragment, probabilistic link.
     */
    LIKELY_SAME,

    /**
     * Fragment = Fragment, confirmed by the user.
     */
    CONFIRMED_SAME,

    /**
     * Credential or Fragment -> User ownership.
     */
    BELONGS_TO,

    /**
     * Claim -> Claim, newer value for the same attribute.
     */
    TEMPORAL_SUCCESSOR
}
