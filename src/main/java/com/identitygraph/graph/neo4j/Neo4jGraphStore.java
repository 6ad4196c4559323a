package com.identitygraph.graph.neo4j;

import com.identitygraph.graph.ClaimNode;
import com.identitygraph.graph.ConflictView;
import com.identitygraph.graph.CredentialNode;
import com.identitygraph.graph.ExistingClaim;
import com.identitygraph.graph.GraphEdgeView;
import com.identitygraph.graph.GraphNodeView;
import com.identitygraph.graph.GraphStore;
import com.identitygraph.graph.GraphStoreException;
import com.identitygraph.graph.IdentityGraphView;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Relationship;

import java.time.ZoneOffset;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Neo4j implementation of GraphStore.
 *
 * Every operation opens its own session and runs a single auto-commit Cypher
 * statement. Driver errors, including a MATCH that finds no endpoint node,
 * are wrapped in {@link GraphStoreException}.
 *
 * GRAPH LAYOUT:
 *   (:Credential)-[:BELONGS_TO]->(:User)
 *   (:Credential)-[:SUPPORTS]->(:Claim)
 *   (:Claim)-[:CONTRADICTS {confidence}]->(:Claim)
 *
 * Every node carries a {@code node_id} property, every edge an {@code edge_id}.
 */
@Slf4j
public class Neo4jGraphStore implements GraphStore {

    private static final List<String> INDEXES = List.of(
        "CREATE INDEX IF NOT EXISTS FOR (n:Claim) ON (n.attribute)",
        "CREATE INDEX IF NOT EXISTS FOR (n:Claim) ON (n.node_id)",
        "CREATE INDEX IF NOT EXISTS FOR (n:Credential) ON (n.node_id)",
        "CREATE INDEX IF NOT EXISTS FOR (n:Fragment) ON (n.node_id)",
        "CREATE INDEX IF NOT EXISTS FOR (n:User) ON (n.node_id)"
    );

    private static final String UPSERT_USER = """
        MERGE (u:User {node_id: $user_id})
        ON CREATE SET u.created_at = datetime()
        RETURN u.node_id AS node_id
        """;

    private static final String CREATE_CREDENTIAL = """
        MATCH (u:User {node_id: $user_id})
        CREATE (c:Credential {
            node_id: $node_id,
            issuer: $issuer,
            issuer_name: $issuer_name,
            credential_type: $credential_type,
            issuance_date: $issuance_date,
            event_id: $event_id,
            created_at: $created_at
        })
        CREATE (c)-[:BELONGS_TO {edge_id: randomUUID(), confidence: 1.0, created_at: datetime()}]->(u)
        RETURN c.node_id AS node_id
        """;

    private static final String CREATE_CLAIM = """
        CREATE (c:Claim {
            node_id: $node_id,
            attribute: $attribute,
            value: $value,
            confidence: $confidence,
            created_at: $created_at
        })
        RETURN c.node_id AS node_id
        """;

    private static final String CREATE_SUPPORTS = """
        MATCH (cr:Credential {node_id: $credential_id})
        MATCH (cl:Claim {node_id: $claim_id})
        CREATE (cr)-[r:SUPPORTS {edge_id: randomUUID(), confidence: 1.0, created_at: datetime()}]->(cl)
        RETURN r.edge_id AS edge_id
        """;

    private static final String CREATE_CONTRADICTS = """
        MATCH (a:Claim {node_id: $claim_a_id})
        MATCH (b:Claim {node_id: $claim_b_id})
        CREATE (a)-[r:CONTRADICTS {edge_id: randomUUID(), confidence: $confidence, created_at: datetime()}]->(b)
        RETURN r.edge_id AS edge_id
        """;

    private static final String FIND_EXISTING_CLAIMS = """
        MATCH (u:User {node_id: $user_id})
        MATCH (c:Claim {attribute: $attribute})<-[:SUPPORTS]-(:Credential)-[:BELONGS_TO]->(u)
        RETURN c.node_id AS node_id, c.attribute AS attribute, c.value AS value
        """;

    private static final String USER_GRAPH = """
        MATCH (u:User {node_id: $user_id})
        OPTIONAL MATCH (cr:Credential)-[:BELONGS_TO]->(u)
        OPTIONAL MATCH (cr)-[:SUPPORTS]->(cl:Claim)
        WITH u, collect(DISTINCT cr) + collect(DISTINCT cl) AS owned
        WITH [u] + owned AS members
        UNWIND members AS a
        OPTIONAL MATCH (a)-[r]->(b)
        WHERE b IN members
        RETURN members, collect(DISTINCT r) AS edges
        """;

    private static final String FIND_NODE = """
        MATCH (n {node_id: $node_id})
        RETURN n
        LIMIT 1
        """;

    private static final String USER_CONFLICTS = """
        MATCH (u:User {node_id: $user_id})<-[:BELONGS_TO]-(:Credential)-[:SUPPORTS]->(c1:Claim)
        MATCH (c1)-[r:CONTRADICTS]->(c2:Claim)
        RETURN DISTINCT
            r.edge_id AS conflict_id,
            c1.attribute AS attribute,
            c1.node_id AS claim_a_id,
            c1.value AS claim_a_value,
            c2.node_id AS claim_b_id,
            c2.value AS claim_b_value
        """;

    private final Driver driver;

    public Neo4jGraphStore(Driver driver) {
        this.driver = driver;
    }

    /**
     * Create the lookup indexes. Failures are logged and startup continues.
     */
    public void createIndexes() {
        for (String index : INDEXES) {
            try (Session session = driver.session()) {
                session.run(index).consume();
            } catch (Neo4jException e) {
                log.warn("Index creation warning: {}", e.getMessage());
            }
        }
        log.info("Neo4j indexes ensured");
    }

    @Override
    public String upsertUser(String userId) {
        return execute("upsertUser", session -> session
            .run(UPSERT_USER, params("user_id", userId))
            .single().get("node_id").asString());
    }

    @Override
    public String createCredentialNode(CredentialNode credential, String userId) {
        Map<String, Object> params = params(
            "user_id", userId,
            "node_id", credential.getNodeId(),
            "issuer", credential.getIssuer(),
            "issuer_name", credential.getIssuerName(),
            "credential_type", credential.getCredentialType(),
            "issuance_date", credential.getIssuanceDate(),
            "event_id", credential.getEventId(),
            "created_at", credential.getCreatedAt().atOffset(ZoneOffset.UTC)
        );
        return execute("createCredentialNode", session -> session
            .run(CREATE_CREDENTIAL, params)
            .single().get("node_id").asString());
    }

    @Override
    public String createClaimNode(ClaimNode claim) {
        Map<String, Object> params = params(
            "node_id", claim.getNodeId(),
            "attribute", claim.getAttribute(),
            "value", claim.getValue(),
            "confidence", claim.getConfidence(),
            "created_at", claim.getCreatedAt().atOffset(ZoneOffset.UTC)
        );
        return execute("createClaimNode", session -> session
            .run(CREATE_CLAIM, params)
            .single().get("node_id").asString());
    }

    @Override
    public String createSupportsEdge(String credentialId, String claimId) {
        return execute("createSupportsEdge", session -> session
            .run(CREATE_SUPPORTS, params("credential_id", credentialId, "claim_id", claimId))
            .single().get("edge_id").asString());
    }

    @Override
    public String createContradictsEdge(String claimAId, String claimBId, double confidence) {
        Map<String, Object> params = params(
            "claim_a_id", claimAId,
            "claim_b_id", claimBId,
            "confidence", confidence
        );
        return execute("createContradictsEdge", session -> session
            .run(CREATE_CONTRADICTS, params)
            .single().get("edge_id").asString());
    }

    @Override
    public List<ExistingClaim> findExistingClaims(String userId, String attribute) {
        return execute("findExistingClaims", session -> session
            .run(FIND_EXISTING_CLAIMS, params("user_id", userId, "attribute", attribute))
            .list(record -> new ExistingClaim(
                record.get("node_id").asString(),
                record.get("attribute").asString(),
                stringOrNull(record.get("value"))
            )));
    }

    @Override
    public IdentityGraphView getUserGraph(String userId) {
        return execute("getUserGraph", session -> {
            List<Record> records = session.run(USER_GRAPH, params("user_id", userId)).list();
            if (records.isEmpty()) {
                return IdentityGraphView.empty();
            }
            Record record = records.get(0);

            // elementId → node_id, to resolve relationship endpoints
            Map<String, String> nodeIds = new HashMap<>();
            List<GraphNodeView> nodes = new ArrayList<>();
            for (Node node : record.get("members").asList(Value::asNode)) {
                GraphNodeView view = toView(node);
                nodeIds.put(node.elementId(), view.getNodeId());
                nodes.add(view);
            }

            List<GraphEdgeView> edges = new ArrayList<>();
            for (Relationship rel : record.get("edges").asList(Value::asRelationship)) {
                Value edgeId = rel.get("edge_id");
                Value confidence = rel.get("confidence");
                edges.add(new GraphEdgeView(
                    edgeId.isNull() ? rel.elementId() : edgeId.asString(),
                    rel.type(),
                    nodeIds.get(rel.startNodeElementId()),
                    nodeIds.get(rel.endNodeElementId()),
                    confidence.isNull() ? 1.0 : confidence.asDouble()
                ));
            }

            return new IdentityGraphView(nodes, edges);
        });
    }

    @Override
    public Optional<GraphNodeView> findNode(String nodeId) {
        return execute("findNode", session -> session
            .run(FIND_NODE, params("node_id", nodeId))
            .list(record -> toView(record.get("n").asNode()))
            .stream()
            .findFirst());
    }

    @Override
    public List<ConflictView> getConflicts(String userId) {
        return execute("getConflicts", session -> session
            .run(USER_CONFLICTS, params("user_id", userId))
            .list(record -> new ConflictView(
                stringOrNull(record.get("conflict_id")),
                stringOrNull(record.get("attribute")),
                stringOrNull(record.get("claim_a_id")),
                stringOrNull(record.get("claim_a_value")),
                stringOrNull(record.get("claim_b_id")),
                stringOrNull(record.get("claim_b_value"))
            )));
    }

    @Override
    public String getStoreName() {
        return "Neo4j";
    }

    @Override
    public boolean isHealthy() {
        try {
            driver.verifyConnectivity();
            return true;
        } catch (Neo4jException e) {
            log.warn("Neo4j not reachable: {}", e.getMessage());
            return false;
        }
    }

    private <T> T execute(String operation, Function<Session, T> work) {
        try (Session session = driver.session()) {
            return work.apply(session);
        } catch (Neo4jException | NoSuchElementException e) {
            log.error("Neo4j operation {} failed", operation, e);
            throw new GraphStoreException("Graph store operation failed: " + e.getMessage(), operation, e);
        }
    }

    private static GraphNodeView toView(Node node) {
        Iterator<String> labels = node.labels().iterator();
        Map<String, Object> properties = new LinkedHashMap<>();
        node.asMap().forEach((key, value) ->
            properties.put(key, value instanceof TemporalAccessor ? value.toString() : value));
        return new GraphNodeView(
            stringOrNull(node.get("node_id")),
            labels.hasNext() ? labels.next() : "Unknown",
            properties
        );
    }

    private static String stringOrNull(Value value) {
        return value == null || value.isNull() ? null : value.asString();
    }

    // HashMap, because Cypher parameters may legitimately be null
    private static Map<String, Object> params(Object... keysAndValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            params.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return params;
    }
}
