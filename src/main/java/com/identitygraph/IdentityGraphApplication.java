package com.identitygraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.neo4j.Neo4jAutoConfiguration;

/**
 * Main application class for the Identity Graph Engine.
 *
 * The engine consumes identity events (verifiable credentials and OIDC tokens),
 * decomposes them into atomic claims stored in a property graph, and flags
 * claims about the same subject that contradict each other.
 *
 * The Neo4j driver is wired explicitly by {@link com.identitygraph.graph.GraphStoreConfig}
 * so that the in-memory graph store can run without one.
 */
@SpringBootApplication(exclude = Neo4jAutoConfiguration.class)
public class IdentityGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(IdentityGraphApplication.class, args);
    }
}
