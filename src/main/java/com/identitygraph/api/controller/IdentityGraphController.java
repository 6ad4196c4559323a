package com.identitygraph.api.controller;

import com.identitygraph.common.exception.NodeNotFoundException;
import com.identitygraph.conflict.ConflictDetector;
import com.identitygraph.conflict.ConflictResolution;
import com.identitygraph.graph.ConflictView;
import com.identitygraph.graph.GraphNodeView;
import com.identitygraph.graph.GraphStore;
import com.identitygraph.graph.IdentityGraphView;
import com.identitygraph.messaging.PendingEventDrainer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for reading identity graphs and managing conflicts.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Identity Graph", description = "Identity graph and conflict API")
public class IdentityGraphController {

    private final GraphStore graphStore;
    private final ConflictDetector conflictDetector;
    private final PendingEventDrainer pendingEventDrainer;

    @GetMapping("/users/{userId}/graph")
    @Operation(summary = "Get a user's identity graph")
    public ResponseEntity<IdentityGraphView> getUserGraph(@PathVariable String userId) {
        return ResponseEntity.ok(graphStore.getUserGraph(userId));
    }

    @GetMapping("/users/{userId}/conflicts")
    @Operation(summary = "List conflicting claims for a user")
    public ResponseEntity<List<ConflictView>> getUserConflicts(@PathVariable String userId) {
        return ResponseEntity.ok(conflictDetector.getUserConflicts(userId));
    }

    @GetMapping("/nodes/{nodeId}")
    @Operation(summary = "Get a graph node")
    public ResponseEntity<GraphNodeView> getNode(@PathVariable String nodeId) {
        GraphNodeView node = graphStore.findNode(nodeId)
            .orElseThrow(() -> new NodeNotFoundException(nodeId));
        return ResponseEntity.ok(node);
    }

    @PostMapping("/conflicts/{conflictId}/resolve")
    @Operation(summary = "Choose the preferred claim of a conflict")
    public ResponseEntity<ConflictResolution> resolveConflict(
            @PathVariable String conflictId,
            @RequestParam String preferredClaimId) {
        return ResponseEntity.ok(conflictDetector.resolveConflict(conflictId, preferredClaimId));
    }

    @PostMapping("/events/process")
    @Operation(summary = "Process events waiting in the queue")
    public ResponseEntity<Map<String, Integer>> processPendingEvents(
            @RequestParam(defaultValue = "" + PendingEventDrainer.DEFAULT_MAX_MESSAGES) int maxMessages) {
        if (maxMessages < 1) {
            throw new IllegalArgumentException("maxMessages must be positive");
        }
        int processed = pendingEventDrainer.processPending(maxMessages);
        return ResponseEntity.ok(Map.of("processed", processed));
    }
}
