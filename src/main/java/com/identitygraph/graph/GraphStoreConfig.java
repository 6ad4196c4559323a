package com.identitygraph.graph;

import com.identitygraph.graph.memory.InMemoryGraphStore;
import com.identitygraph.graph.neo4j.Neo4jGraphStore;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the graph store implementation.
 *
 * {@code identity-graph.graph-store=neo4j} (default) wires a Bolt driver and the
 * Neo4j store; {@code in-memory} wires the in-memory store and no driver.
 */
@Configuration
@Slf4j
public class GraphStoreConfig {

    @Configuration
    @ConditionalOnProperty(name = "identity-graph.graph-store", havingValue = "neo4j", matchIfMissing = true)
    static class Neo4jStoreConfig {

        @Bean
        public Driver neo4jDriver(
                @Value("${identity-graph.neo4j.uri:bolt://localhost:7687}") String uri,
                @Value("${identity-graph.neo4j.user:neo4j}") String user,
                @Value("${identity-graph.neo4j.password:password}") String password) {
            log.info("Neo4j driver initialized: uri={}, user={}", uri, user);
            return GraphDatabase.driver(uri, AuthTokens.basic(user, password));
        }

        @Bean(initMethod = "createIndexes")
        public Neo4jGraphStore neo4jGraphStore(Driver driver) {
            return new Neo4jGraphStore(driver);
        }
    }

    @Bean
    @ConditionalOnProperty(name = "identity-graph.graph-store", havingValue = "in-memory")
    public InMemoryGraphStore inMemoryGraphStore() {
        log.warn("Using in-memory graph store; graph state is lost on restart");
        return new InMemoryGraphStore();
    }
}
