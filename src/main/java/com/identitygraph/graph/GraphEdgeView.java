package com.identitygraph.graph;

import lombok.Value;

/**
 * Read-side view of a stored edge.
 */
@Value
public class GraphEdgeView {
    String edgeId;
    String edgeType;
    String sourceId;
    String targetId;
    double confidence;
}
