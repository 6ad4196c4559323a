package com.identitygraph.common.exception;

/**
 * Thrown when a graph node is not found.
 */
public class NodeNotFoundException extends IdentityGraphException {

    public NodeNotFoundException(String nodeId) {
        super("Node not found: " + nodeId);
    }
}
