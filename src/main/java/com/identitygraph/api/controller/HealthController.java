package com.identitygraph.api.controller;

import com.identitygraph.graph.GraphStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and readiness endpoints.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Health", description = "Service health API")
public class HealthController {

    static final String SERVICE_NAME = "identity-graph-engine";
    static final String VERSION = "1.0.0";

    private final GraphStore graphStore;
    private final ConnectionFactory connectionFactory;

    @GetMapping("/health")
    @Operation(summary = "Liveness check")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", SERVICE_NAME);
        body.put("version", VERSION);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/ready")
    @Operation(summary = "Readiness check against the graph store and the broker")
    public ResponseEntity<Map<String, Object>> ready() {
        boolean graphReady = graphStore.isHealthy();
        boolean brokerReady = isBrokerReachable();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ready", graphReady && brokerReady);
        body.put("graph_store", graphStore.getStoreName());
        body.put("graph_store_healthy", graphReady);
        body.put("rabbitmq", brokerReady);

        HttpStatus status = graphReady && brokerReady ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(body);
    }

    private boolean isBrokerReachable() {
        try (Connection connection = connectionFactory.createConnection()) {
            return connection.isOpen();
        } catch (AmqpException e) {
            log.warn("RabbitMQ not reachable: {}", e.getMessage());
            return false;
        }
    }
}
