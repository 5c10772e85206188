package com.example.verifierfrontend.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InitTransactionRequestTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serializesWireNamesAndOmitsAbsentFields() {
        InitTransactionRequest request = new InitTransactionRequest(
                PresentationType.VP_TOKEN,
                objectMapper.createObjectNode().put("id", "pd-1"),
                "nonce-1",
                ResponseMode.DIRECT_POST_JWT,
                EmbedMode.BY_REFERENCE,
                null,
                "{\"kty\":\"EC\"}",
                null);

        JsonNode json = objectMapper.valueToTree(request);

        assertThat(json.get("type").asText()).isEqualTo("vp_token");
        assertThat(json.get("presentation_definition").get("id").asText()).isEqualTo("pd-1");
        assertThat(json.get("nonce").asText()).isEqualTo("nonce-1");
        assertThat(json.get("response_mode").asText()).isEqualTo("direct_post.jwt");
        assertThat(json.get("jar_mode").asText()).isEqualTo("by_reference");
        assertThat(json.get("ephemeral_ecdh_public_jwk").asText()).isEqualTo("{\"kty\":\"EC\"}");
        assertThat(json.has("presentation_definition_mode")).isFalse();
        assertThat(json.has("wallet_response_redirect_uri_template")).isFalse();
    }

}
