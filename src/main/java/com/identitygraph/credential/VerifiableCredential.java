package com.identitygraph.credential;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A W3C Verifiable Credential as received in an ingestion payload.
 *
 * Parsing is best-effort: missing members default to empty values and no
 * schema validation is applied. The proof is carried but never decomposed.
 */
@Value
@Builder
public class VerifiableCredential {

    /**
     * Generic type every credential carries; never the most specific one
     * when anything else is listed.
     */
    public static final String GENERIC_TYPE = "VerifiableCredential";

    @Builder.Default
    List<String> context = List.of();

    @Builder.Default
    List<String> types = List.of();

    String id;

    @Builder.Default
    Issuer issuer = new Issuer.IssuerId("");

    /**
     * Raw issuance date string; parsed by the decomposer.
     */
    String issuanceDate;

    String expirationDate;

    /**
     * Attributes about the subject. Always an object node, possibly empty.
     */
    @Builder.Default
    JsonNode credentialSubject = JsonNodeFactory.instance.objectNode();

    JsonNode proof;

    /**
     * Create a credential from its JSON document.
     */
    public static VerifiableCredential fromJson(JsonNode document) {
        JsonNode subject = document.path("credentialSubject");
        return VerifiableCredential.builder()
            .context(stringList(document.get("@context")))
            .types(stringList(document.get("type")))
            .id(textOrNull(document.get("id")))
            .issuer(Issuer.from(document.get("issuer")))
            .issuanceDate(textOrNull(document.get("issuanceDate")))
            .expirationDate(textOrNull(document.get("expirationDate")))
            .credentialSubject(subject.isObject() ? subject : JsonNodeFactory.instance.objectNode())
            .proof(document.get("proof"))
            .build();
    }

    public String getIssuerId() {
        return issuer.getId();
    }

    public Optional<String> getIssuerName() {
        return issuer.getName();
    }

    /**
     * Get the most specific credential type: the first listed type that is not
     * the generic marker, or the generic marker itself.
     */
    public String getCredentialType() {
        return types.stream()
            .filter(type -> !GENERIC_TYPE.equals(type))
            .findFirst()
            .orElse(GENERIC_TYPE);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    // "type" and "@context" may be a single string or an array
    private static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            return List.of(node.asText());
        }
        List<String> values = new ArrayList<>();
        node.forEach(element -> {
            if (element.isTextual()) {
                values.add(element.textValue());
            }
        });
        return Collections.unmodifiableList(values);
    }
}
