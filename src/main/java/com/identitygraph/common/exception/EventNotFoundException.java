package com.identitygraph.common.exception;

/**
 * Thrown when an ingestion event is not found in the audit log.
 */
public class EventNotFoundException extends IdentityGraphException {

    public EventNotFoundException(String eventId) {
        super("Event not found: " + eventId);
    }
}
