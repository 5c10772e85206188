package com.example.verifierfrontend.service.port;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * JSON transport to the verifier backend. Implementations throw on transport errors and non-2xx
 * responses and return the raw body; validating its shape is up to the caller.
 */
public interface VerifierApiClient {

    JsonNode post(String baseUrl, String path, Object body);

    JsonNode get(String baseUrl, String path, Map<String, String> queryParams);

}
