package com.example.verifierfrontend.service.port;

/**
 * Builds the URI template the wallet redirects to after posting its response.
 * The placeholder must appear verbatim so the backend can substitute the response code.
 */
@FunctionalInterface
public interface WalletResponseRedirectUriTemplateGenerator {

    String generate(String baseUrl, String path, String placeholder);

}
