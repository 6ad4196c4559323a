package com.identitygraph.conflict;

import lombok.Value;

import java.time.Instant;

/**
 * A contradiction detected between a new claim (A) and an existing claim (B)
 * with the same attribute under the same user.
 */
@Value
public class Conflict {

    /**
     * Id of the CONTRADICTS edge recording this conflict.
     */
    String conflictId;

    String attribute;

    String claimAId;
    String claimAValue;

    String claimBId;
    String claimBValue;

    Instant detectedAt;
}
