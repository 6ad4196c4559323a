package com.identitygraph.graph;

import com.identitygraph.common.exception.IdentityGraphException;

/**
 * Exception thrown when graph store operations fail.
 *
 * This wraps all errors from the underlying graph database (connectivity loss,
 * query failures, missing endpoint nodes), allowing callers to handle them
 * consistently. The core never retries; redelivery is the event source's call.
 */
public class GraphStoreException extends IdentityGraphException {

    private final String operation;

    public GraphStoreException(String message, String operation) {
        super(message);
        this.operation = operation;
    }

    public GraphStoreException(String message, String operation, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
