package com.identitygraph.conflict;

import com.identitygraph.graph.ClaimNode;
import com.identitygraph.graph.ConflictView;
import com.identitygraph.graph.ExistingClaim;
import com.identitygraph.graph.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Detects contradictions between newly created claims and the claims a user
 * already has.
 *
 * Two claims conflict when they share an attribute path and their stringified
 * values differ (a null value compares as the empty string). Every conflict is
 * recorded as a CONTRADICTS edge from the new claim to the existing one.
 *
 * Detection is not deduplicated: running it twice over the same claims records
 * every conflict twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConflictDetector {

    private static final double CONFLICT_CONFIDENCE = 1.0;

    private final GraphStore graphStore;

    public List<Conflict> detectConflicts(String userId, List<ClaimNode> newClaims) {
        List<Conflict> conflicts = new ArrayList<>();

        for (ClaimNode newClaim : newClaims) {
            List<ExistingClaim> existingClaims = graphStore.findExistingClaims(userId, newClaim.getAttribute());

            for (ExistingClaim existing : existingClaims) {
                if (existing.getNodeId().equals(newClaim.getNodeId())) {
                    continue;
                }

                String newValue = Objects.toString(newClaim.getValue(), "");
                String existingValue = Objects.toString(existing.getValue(), "");
                if (newValue.equals(existingValue)) {
                    continue;
                }

                String edgeId = graphStore.createContradictsEdge(
                    newClaim.getNodeId(), existing.getNodeId(), CONFLICT_CONFIDENCE);

                conflicts.add(new Conflict(
                    edgeId,
                    newClaim.getAttribute(),
                    newClaim.getNodeId(),
                    newClaim.getValue(),
                    existing.getNodeId(),
                    existing.getValue(),
                    Instant.now()
                ));

                log.warn("Conflict detected for user {}: {} '{}' vs '{}'",
                    userId, newClaim.getAttribute(), newValue, existingValue);
            }
        }

        if (!conflicts.isEmpty()) {
            log.info("Detected {} conflicts for user {}", conflicts.size(), userId);
        }
        return conflicts;
    }

    public List<ConflictView> getUserConflicts(String userId) {
        return graphStore.getConflicts(userId);
    }

    /**
     * Record a user's preferred claim for a conflict.
     *
     * Not persisted yet: the request is logged and reported as accepted.
     */
    public ConflictResolution resolveConflict(String conflictId, String preferredClaimId) {
        log.info("Conflict {} resolution requested, preferred claim {} (not persisted)",
            conflictId, preferredClaimId);
        return new ConflictResolution(conflictId, preferredClaimId, true, false);
    }
}
