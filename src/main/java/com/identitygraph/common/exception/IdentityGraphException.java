package com.identitygraph.common.exception;

/**
 * Base exception for all identity graph exceptions.
 */
public class IdentityGraphException extends RuntimeException {

    public IdentityGraphException(String message) {
        super(message);
    }

    public IdentityGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
