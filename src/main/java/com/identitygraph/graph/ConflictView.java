package com.identitygraph.graph;

import lombok.Value;

/**
 * One stored CONTRADICTS edge, as listed by the read API.
 *
 * Claim A is the edge's source (the claim that was new when the conflict was
 * detected), claim B its target.
 */
@Value
public class ConflictView {
    String conflictId;
    String attribute;
    String claimAId;
    String claimAValue;
    String claimBId;
    String claimBValue;
}
