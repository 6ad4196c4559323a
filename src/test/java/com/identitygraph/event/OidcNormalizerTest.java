package com.identitygraph.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.identitygraph.credential.VerifiableCredential;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OidcNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testToCredentialDocument_MapsStandardClaims() throws Exception {
        JsonNode claims = objectMapper.readTree("""
            {
              "iss": "https://accounts.example.com",
              "sub": "1234567890",
              "email": "alice@example.com",
              "name": "Alice Smith",
              "family_name": "Smith",
              "email_verified": true,
              "timestamp": "2024-02-01T08:00:00Z"
            }
            """);

        ObjectNode document = OidcNormalizer.toCredentialDocument(claims);

        assertEquals("https://www.w3.org/2018/credentials/v1", document.get("@context").get(0).asText());
        assertEquals("https://accounts.example.com", document.get("issuer").asText());
        assertEquals("2024-02-01T08:00:00Z", document.get("issuanceDate").asText());

        JsonNode subject = document.get("credentialSubject");
        List<String> members = new ArrayList<>();
        subject.fieldNames().forEachRemaining(members::add);
        assertEquals(List.of("id", "email", "name", "family_name"), members);
        assertEquals("1234567890", subject.get("id").asText());

        VerifiableCredential credential = VerifiableCredential.fromJson(document);
        assertEquals("OIDCCredential", credential.getCredentialType());
    }

    @Test
    void testToCredentialDocument_Defaults() throws Exception {
        JsonNode claims = objectMapper.readTree("""
            {"sub": "1234567890", "email": null, "timestamp": ""}
            """);

        ObjectNode document = OidcNormalizer.toCredentialDocument(claims);

        assertEquals(OidcNormalizer.UNKNOWN_ISSUER, document.get("issuer").asText());
        assertFalse(document.has("issuanceDate"));
        assertEquals(1, document.get("credentialSubject").size());
        assertFalse(document.get("credentialSubject").has("email"));
    }
}
