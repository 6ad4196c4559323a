package com.identitygraph.decomposition;

import com.identitygraph.graph.ClaimNode;
import com.identitygraph.graph.CredentialNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of decomposing one credential.
 *
 * {@code conflictsDetected} is filled in by the event processor after
 * conflict detection has run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecompositionResult {

    private CredentialNode credentialNode;

    @Builder.Default
    private List<ClaimNode> claimNodes = new ArrayList<>();

    /**
     * Number of SUPPORTS edges created; always equal to the claim count.
     */
    private int edgesCreated;

    private int conflictsDetected;
}
