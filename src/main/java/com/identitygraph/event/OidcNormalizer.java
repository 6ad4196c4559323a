package com.identitygraph.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps decoded OIDC token claims onto a verifiable credential document so they
 * can be decomposed like any other credential.
 */
public final class OidcNormalizer {

    static final String CREDENTIALS_CONTEXT = "https://www.w3.org/2018/credentials/v1";
    static final String OIDC_CREDENTIAL_TYPE = "OIDCCredential";
    static final String UNKNOWN_ISSUER = "unknown";

    // credential subject member → OIDC claim, in output order
    private static final Map<String, String> SUBJECT_CLAIMS = new LinkedHashMap<>();

    static {
        SUBJECT_CLAIMS.put("id", "sub");
        SUBJECT_CLAIMS.put("email", "email");
        SUBJECT_CLAIMS.put("name", "name");
        SUBJECT_CLAIMS.put("given_name", "given_name");
        SUBJECT_CLAIMS.put("family_name", "family_name");
        SUBJECT_CLAIMS.put("picture", "picture");
    }

    private OidcNormalizer() {
    }

    public static ObjectNode toCredentialDocument(JsonNode claims) {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        ObjectNode document = factory.objectNode();

        document.putArray("@context").add(CREDENTIALS_CONTEXT);
        document.putArray("type").add("VerifiableCredential").add(OIDC_CREDENTIAL_TYPE);

        JsonNode issuer = claims.path("iss");
        document.set("issuer", issuer.isMissingNode() || issuer.isNull() ? factory.textNode(UNKNOWN_ISSUER) : issuer);

        JsonNode timestamp = claims.path("timestamp");
        if (!timestamp.isMissingNode() && !timestamp.isNull() && !timestamp.asText().isEmpty()) {
            document.put("issuanceDate", timestamp.asText());
        }

        ObjectNode subject = document.putObject("credentialSubject");
        SUBJECT_CLAIMS.forEach((member, claim) -> {
            JsonNode value = claims.path(claim);
            if (!value.isMissingNode() && !value.isNull()) {
                subject.set(member, value);
            }
        });

        return document;
    }
}
