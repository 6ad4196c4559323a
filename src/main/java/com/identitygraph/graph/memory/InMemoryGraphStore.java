package com.identitygraph.graph.memory;

import com.identitygraph.graph.ClaimNode;
import com.identitygraph.graph.ConflictView;
import com.identitygraph.graph.CredentialNode;
import com.identitygraph.graph.EdgeType;
import com.identitygraph.graph.ExistingClaim;
import com.identitygraph.graph.GraphEdgeView;
import com.identitygraph.graph.GraphNodeView;
import com.identitygraph.graph.GraphStore;
import com.identitygraph.graph.GraphStoreException;
import com.identitygraph.graph.IdentityGraphView;
import com.identitygraph.graph.NodeType;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory graph store for development and testing.
 *
 * This store keeps nodes and edges in insertion-ordered collections and answers
 * the same queries as the Neo4j store, so the engine can run without external
 * dependencies.
 *
 * USE CASES:
 * - Unit and integration testing
 * - Local development without a graph database
 *
 * NOT FOR PRODUCTION:
 * State is lost on restart and every method synchronizes on the store.
 */
@Slf4j
public class InMemoryGraphStore implements GraphStore {

    // nodeId → node, insertion ordered
    private final Map<String, StoredNode> nodes = new LinkedHashMap<>();

    private final List<StoredEdge> edges = new ArrayList<>();

    // Simulate health status
    private volatile boolean healthy = true;

    @Override
    public synchronized String upsertUser(String userId) {
        if (!nodes.containsKey(userId)) {
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("created_at", Instant.now().toString());
            nodes.put(userId, new StoredNode(userId, NodeType.USER, properties));
            log.debug("InMemory: Created user node {}", userId);
        }
        return userId;
    }

    @Override
    public synchronized String createCredentialNode(CredentialNode credential, String userId) {
        requireNode(userId, NodeType.USER, "createCredentialNode");

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("issuer", credential.getIssuer());
        properties.put("issuer_name", credential.getIssuerName());
        properties.put("credential_type", credential.getCredentialType());
        properties.put("issuance_date", credential.getIssuanceDate() != null
            ? credential.getIssuanceDate().toString() : null);
        properties.put("event_id", credential.getEventId());
        properties.put("created_at", credential.getCreatedAt().toString());

        nodes.put(credential.getNodeId(), new StoredNode(credential.getNodeId(), NodeType.CREDENTIAL, properties));
        addEdge(EdgeType.BELONGS_TO, credential.getNodeId(), userId, 1.0);

        return credential.getNodeId();
    }

    @Override
    public synchronized String createClaimNode(ClaimNode claim) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("attribute", claim.getAttribute());
        properties.put("value", claim.getValue());
        properties.put("confidence", claim.getConfidence());
        properties.put("created_at", claim.getCreatedAt().toString());

        nodes.put(claim.getNodeId(), new StoredNode(claim.getNodeId(), NodeType.CLAIM, properties));
        return claim.getNodeId();
    }

    @Override
    public synchronized String createSupportsEdge(String credentialId, String claimId) {
        requireNode(credentialId, NodeType.CREDENTIAL, "createSupportsEdge");
        requireNode(claimId, NodeType.CLAIM, "createSupportsEdge");
        return addEdge(EdgeType.SUPPORTS, credentialId, claimId, 1.0);
    }

    @Override
    public synchronized String createContradictsEdge(String claimAId, String claimBId, double confidence) {
        requireNode(claimAId, NodeType.CLAIM, "createContradictsEdge");
        requireNode(claimBId, NodeType.CLAIM, "createContradictsEdge");
        return addEdge(EdgeType.CONTRADICTS, claimAId, claimBId, confidence);
    }

    @Override
    public synchronized List<ExistingClaim> findExistingClaims(String userId, String attribute) {
        List<ExistingClaim> result = new ArrayList<>();
        for (String claimId : ownedClaimIds(userId)) {
            StoredNode claim = nodes.get(claimId);
            if (attribute.equals(claim.properties.get("attribute"))) {
                result.add(new ExistingClaim(claimId, attribute, (String) claim.properties.get("value")));
            }
        }
        return result;
    }

    @Override
    public synchronized IdentityGraphView getUserGraph(String userId) {
        StoredNode user = nodes.get(userId);
        if (user == null || user.type != NodeType.USER) {
            return IdentityGraphView.empty();
        }

        Set<String> members = new LinkedHashSet<>();
        members.add(userId);
        members.addAll(ownedCredentialIds(userId));
        members.addAll(ownedClaimIds(userId));

        List<GraphNodeView> nodeViews = new ArrayList<>();
        for (String nodeId : members) {
            nodeViews.add(nodes.get(nodeId).toView());
        }

        List<GraphEdgeView> edgeViews = new ArrayList<>();
        for (StoredEdge edge : edges) {
            if (members.contains(edge.sourceId) && members.contains(edge.targetId)) {
                edgeViews.add(edge.toView());
            }
        }

        return new IdentityGraphView(nodeViews, edgeViews);
    }

    @Override
    public synchronized Optional<GraphNodeView> findNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId)).map(StoredNode::toView);
    }

    @Override
    public synchronized List<ConflictView> getConflicts(String userId) {
        Set<String> owned = ownedClaimIds(userId);
        List<ConflictView> conflicts = new ArrayList<>();
        for (StoredEdge edge : edges) {
            if (edge.type == EdgeType.CONTRADICTS && owned.contains(edge.sourceId)) {
                StoredNode a = nodes.get(edge.sourceId);
                StoredNode b = nodes.get(edge.targetId);
                conflicts.add(new ConflictView(
                    edge.edgeId,
                    (String) a.properties.get("attribute"),
                    a.nodeId,
                    (String) a.properties.get("value"),
                    b.nodeId,
                    (String) b.properties.get("value")
                ));
            }
        }
        return conflicts;
    }

    @Override
    public String getStoreName() {
        return "InMemory";
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    /**
     * Set health status (for testing failure scenarios).
     */
    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    /**
     * Count stored nodes of a type (for testing).
     */
    public synchronized long countNodes(NodeType type) {
        return nodes.values().stream().filter(node -> node.type == type).count();
    }

    /**
     * Count stored edges of a type (for testing).
     */
    public synchronized long countEdges(EdgeType type) {
        return edges.stream().filter(edge -> edge.type == type).count();
    }

    /**
     * Clear all state (for test cleanup).
     */
    public synchronized void reset() {
        nodes.clear();
        edges.clear();
        healthy = true;
    }

    private Set<String> ownedCredentialIds(String userId) {
        Set<String> credentialIds = new LinkedHashSet<>();
        for (StoredEdge edge : edges) {
            if (edge.type == EdgeType.BELONGS_TO && edge.targetId.equals(userId)
                    && nodes.get(edge.sourceId).type == NodeType.CREDENTIAL) {
                credentialIds.add(edge.sourceId);
            }
        }
        return credentialIds;
    }

    private Set<String> ownedClaimIds(String userId) {
        Set<String> credentialIds = ownedCredentialIds(userId);
        Set<String> claimIds = new LinkedHashSet<>();
        for (StoredEdge edge : edges) {
            if (edge.type == EdgeType.SUPPORTS && credentialIds.contains(edge.sourceId)) {
                claimIds.add(edge.targetId);
            }
        }
        return claimIds;
    }

    private void requireNode(String nodeId, NodeType type, String operation) {
        StoredNode node = nodes.get(nodeId);
        if (node == null || node.type != type) {
            throw new GraphStoreException(type.getLabel() + " node not found: " + nodeId, operation);
        }
    }

    private String addEdge(EdgeType type, String sourceId, String targetId, double confidence) {
        String edgeId = UUID.randomUUID().toString();
        edges.add(new StoredEdge(edgeId, type, sourceId, targetId, confidence));
        log.debug("InMemory: Created {} edge {} ({} -> {})", type, edgeId, sourceId, targetId);
        return edgeId;
    }

    /**
     * Internal class to hold a node and its properties.
     */
    private static class StoredNode {
        final String nodeId;
        final NodeType type;
        final Map<String, Object> properties;

        StoredNode(String nodeId, NodeType type, Map<String, Object> properties) {
            this.nodeId = nodeId;
            this.type = type;
            this.properties = properties;
            this.properties.put("node_id", nodeId);
        }

        GraphNodeView toView() {
            return new GraphNodeView(nodeId, type.getLabel(), new LinkedHashMap<>(properties));
        }
    }

    /**
     * Internal class to hold an edge.
     */
    private static class StoredEdge {
        final String edgeId;
        final EdgeType type;
        final String sourceId;
        final String targetId;
        final double confidence;

        StoredEdge(String edgeId, EdgeType type, String sourceId, String targetId, double confidence) {
            this.edgeId = edgeId;
            this.type = type;
            this.sourceId = sourceId;
            this.targetId = targetId;
            this.confidence = confidence;
        }

        GraphEdgeView toView() {
            return new GraphEdgeView(edgeId, type.name(), sourceId, targetId, confidence);
        }
    }
}
