package com.identitygraph.graph;

import lombok.Value;

/**
 * A claim already stored in the graph, as returned by the existing-claims query.
 */
@Value
public class ExistingClaim {
    String nodeId;
    String attribute;
    String value;
}
