package com.example.verifierfrontend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.util.Assert;

/**
 * Envelope returned by the verifier backend for a transaction: the protected JARM payload as posted by the wallet.
 *
 * @param state    optional state echoed by the wallet
 * @param response JARM JWT (JWS, JWE or nested), opaque until verified
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WalletResponse(
        @JsonProperty("state") String state,
        @JsonProperty("response") String response
) {

    public WalletResponse {
        Assert.hasText(response, "response must not be empty");
    }

    public static WalletResponse fromJson(JsonNode json, ObjectMapper objectMapper) throws JsonProcessingException {
        Assert.notNull(json, "Wallet response body must not be empty");
        return objectMapper.treeToValue(json, WalletResponse.class);
    }

}
