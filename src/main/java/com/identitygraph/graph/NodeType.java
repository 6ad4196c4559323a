package com.identitygraph.graph;

/**
 * Types of nodes in the identity graph.
 *
 * The value is the label the node carries in the graph store.
 */
public enum NodeType {
    USER("User"),

    /**
     * Identity signal from a single source, not yet linked to a confirmed user.
     * Reserved for fragment linking.
     */
    FRAGMENT("Fragment"),

    CREDENTIAL("Credential"),

    CLAIM("Claim"),

    /**
     * Reserved.
     */
    CONTEXT("Context");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
