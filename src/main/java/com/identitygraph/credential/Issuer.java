package com.identitygraph.credential;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.util.Optional;

/**
 * Issuer of a credential.
 *
 * A credential names its issuer either as a bare identifier string or as an
 * object carrying an identifier and an optional display name. The two shapes
 * are modelled as the two implementations below.
 */
public interface Issuer {

    String getId();

    Optional<String> getName();

    /**
     * Parse the {@code issuer} member of a credential document.
     *
     * An object without an {@code id} falls back to its JSON text as identifier;
     * a missing issuer yields an empty identifier.
     */
    static Issuer from(JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return new IssuerId("");
        }
        if (raw.isObject()) {
            JsonNode id = raw.get("id");
            JsonNode name = raw.get("name");
            return new IssuerProfile(
                id != null && !id.isNull() ? id.asText() : raw.toString(),
                name != null && name.isTextual() ? name.textValue() : null
            );
        }
        return new IssuerId(raw.asText());
    }

    /**
     * Issuer given as a bare identifier, e.g. {@code "did:example:issuer789"}.
     */
    @Value
    class IssuerId implements Issuer {
        String id;

        @Override
        public Optional<String> getName() {
            return Optional.empty();
        }
    }

    /**
     * Issuer given as an object, e.g. {@code {"id": "did:x", "name": "Example U"}}.
     */
    @Value
    class IssuerProfile implements Issuer {
        String id;
        String displayName;

        @Override
        public Optional<String> getName() {
            return Optional.ofNullable(displayName);
        }
    }
}
