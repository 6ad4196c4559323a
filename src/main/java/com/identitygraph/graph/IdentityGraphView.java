package com.identitygraph.graph;

import lombok.Value;

import java.util.List;

/**
 * The identity graph of one user: the user node, its credentials, their claims,
 * and every edge among them.
 */
@Value
public class IdentityGraphView {
    List<GraphNodeView> nodes;
    List<GraphEdgeView> edges;

    public static IdentityGraphView empty() {
        return new IdentityGraphView(List.of(), List.of());
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        return edges.size();
    }
}
