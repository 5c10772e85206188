package com.example.verifierfrontend.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of phase one: where to send the user and whether the wallet runs on the same device.
 */
public record InitTransactionResult(
        @JsonProperty("wallet_redirect_uri") String walletRedirectUri,
        @JsonProperty("is_mobile") boolean isMobile
) {
}
