package com.example.verifierfrontend.service.port;

import java.util.Map;

/**
 * Builds the URI that invokes the wallet with the authorization request parameters.
 */
@FunctionalInterface
public interface WalletRedirectUriGenerator {

    String generate(String walletUrl, Map<String, String> queryParams);

}
