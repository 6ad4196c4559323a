package com.identitygraph.graph;

import java.util.List;
import java.util.Optional;

/**
 * Generic interface for the property graph that holds identity claims.
 *
 * The graph store is the SINGLE SOURCE OF TRUTH for:
 * - Users (subjects)
 * - Credentials and the claims they support
 * - Contradictions detected between claims
 *
 * IMPORTANT PRINCIPLES:
 * - Every call is independent; no store-level transaction spans several calls
 * - Callers never hold an in-process lock around store calls
 * - Writes already issued are never rolled back by the engine
 *
 * Implementations:
 * - Neo4j (production, Cypher over the Bolt driver)
 * - In-memory (development and tests)
 *
 * All failures surface as {@link GraphStoreException}.
 */
public interface GraphStore {

    /**
     * Create the user node if it does not exist yet.
     *
     * Requirements:
     * - MUST be idempotent (repeat calls never duplicate the node)
     * - MUST NOT change the creation timestamp of an existing node
     *
     * @param userId external user id, used as node id
     * @return the user node id
     */
    String upsertUser(String userId);

    /**
     * Create a credential node linked to an existing user via BELONGS_TO.
     *
     * @return the credential node id
     * @throws GraphStoreException if the user node does not exist
     */
    String createCredentialNode(CredentialNode credential, String userId);

    /**
     * Create a standalone claim node.
     *
     * @return the claim node id
     */
    String createClaimNode(ClaimNode claim);

    /**
     * Create a SUPPORTS edge from a credential to a claim.
     *
     * @return the new edge id
     * @throws GraphStoreException if either endpoint does not exist
     */
    String createSupportsEdge(String credentialId, String claimId);

    /**
     * Create a CONTRADICTS edge from claim A to claim B.
     *
     * Never deduplicated: calling twice creates two edges.
     *
     * @return the new edge id
     * @throws GraphStoreException if either endpoint does not exist
     */
    String createContradictsEdge(String claimAId, String claimBId, double confidence);

    /**
     * Find claims with the given attribute that are supported by a credential
     * belonging to the user.
     *
     * @return matching claims; empty if the user is unknown
     */
    List<ExistingClaim> findExistingClaims(String userId, String attribute);

    /**
     * Get the identity graph for a user.
     *
     * @return the user's graph; empty if the user is unknown
     */
    IdentityGraphView getUserGraph(String userId);

    /**
     * Get any node by its id.
     */
    Optional<GraphNodeView> findNode(String nodeId);

    /**
     * List the CONTRADICTS edges whose source claim belongs to the user,
     * one row per edge.
     */
    List<ConflictView> getConflicts(String userId);

    /**
     * Get the name of this graph store.
     * Used for logging and health reporting.
     *
     * @return store name (e.g., "Neo4j", "InMemory")
     */
    String getStoreName();

    /**
     * Health check for graph store connectivity.
     *
     * @return true if the store is reachable and operational
     */
    boolean isHealthy();
}
