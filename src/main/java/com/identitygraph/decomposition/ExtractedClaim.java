package com.identitygraph.decomposition;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * A (path, value) pair flattened out of a credential subject.
 */
@Value
public class ExtractedClaim {

    /**
     * Dot-joined path from the subject root, e.g. {@code address.city}.
     */
    String path;

    JsonNode value;

    public String getStringValue() {
        return ClaimExtractor.stringify(value);
    }
}
