package com.identitygraph.conflict;

import lombok.Value;

/**
 * Result of a conflict resolution request.
 *
 * Preferences are acknowledged but not yet stored, so {@code persisted} is
 * always false for now.
 */
@Value
public class ConflictResolution {
    String conflictId;
    String preferredClaimId;
    boolean success;
    boolean persisted;
}
