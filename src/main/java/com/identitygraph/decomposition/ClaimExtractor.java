package com.identitygraph.decomposition;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Flattens a credential subject into atomic claims.
 *
 * Rules:
 * - Nested objects are walked depth-first, paths joined with '.'
 * - Arrays are not walked; the whole array becomes one claim
 * - Everything else is emitted as-is
 *
 * Member order follows the document; nothing is sorted and there is no depth limit.
 */
@Component
public class ClaimExtractor {

    private static final String PATH_SEPARATOR = ".";

    /**
     * Extract all claims from a subject document.
     *
     * @param document the subject; anything but an object yields no claims
     */
    public List<ExtractedClaim> extract(JsonNode document) {
        List<ExtractedClaim> claims = new ArrayList<>();
        if (document != null && document.isObject()) {
            flatten(document, "", claims);
        }
        return claims;
    }

    /**
     * Stringify a claim value for storage and comparison.
     *
     * Strings are kept verbatim, arrays and objects become their JSON text,
     * JSON null becomes null.
     */
    public static String stringify(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isContainerNode()) {
            return value.toString();
        }
        return value.asText();
    }

    private void flatten(JsonNode node, String prefix, List<ExtractedClaim> claims) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = prefix.isEmpty() ? field.getKey() : prefix + PATH_SEPARATOR + field.getKey();
            JsonNode value = field.getValue();

            if (value.isObject()) {
                flatten(value, path, claims);
            } else {
                claims.add(new ExtractedClaim(path, value));
            }
        }
    }
}
