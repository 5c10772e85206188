package com.example.verifierfrontend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body posted to the verifier backend to open a presentation transaction.
 * Optional fields are left out of the JSON when null.
 *
 * @param walletResponseRedirectUriTemplate only set for same-device (mobile) flows
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InitTransactionRequest(
        @JsonProperty("type") PresentationType type,
        @JsonProperty("presentation_definition") JsonNode presentationDefinition,
        @JsonProperty("nonce") String nonce,
        @JsonProperty("response_mode") ResponseMode responseMode,
        @JsonProperty("jar_mode") EmbedMode jarMode,
        @JsonProperty("presentation_definition_mode") EmbedMode presentationDefinitionMode,
        @JsonProperty("ephemeral_ecdh_public_jwk") String ephemeralEcdhPublicJwk,
        @JsonProperty("wallet_response_redirect_uri_template") String walletResponseRedirectUriTemplate
) {
}
