package com.identitygraph.graph;

import lombok.Value;

import java.util.Map;

/**
 * Read-side view of a stored node.
 *
 * Properties use the stored property names (snake_case); temporal values are
 * rendered as ISO-8601 strings.
 */
@Value
public class GraphNodeView {
    String nodeId;
    String nodeType;
    Map<String, Object> properties;
}
