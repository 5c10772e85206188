package com.example.verifierfrontend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.util.Assert;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verifier backend answer to an init transaction request.
 *
 * @param presentationId transaction id used to fetch the wallet response later
 * @param clientId       verifier client_id the wallet must see
 * @param request        request object passed by value (JAR), optional
 * @param requestUri     where the wallet fetches the request object, optional absolute URL
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InitTransactionResponse(
        @JsonProperty("presentation_id") String presentationId,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("request") String request,
        @JsonProperty("request_uri") String requestUri
) {

    public InitTransactionResponse {
        Assert.hasLength(presentationId, "presentation_id must not be empty");
        Assert.hasLength(clientId, "client_id must not be empty");
        if (requestUri != null) {
            Assert.isTrue(isAbsoluteUrl(requestUri), "request_uri must be an absolute URL: " + requestUri);
        }
    }

    public static InitTransactionResponse fromJson(JsonNode json, ObjectMapper objectMapper) throws JsonProcessingException {
        Assert.notNull(json, "InitTransaction response body must not be empty");
        return objectMapper.treeToValue(json, InitTransactionResponse.class);
    }

    public PresentationId toPresentationId() {
        return new PresentationId(presentationId);
    }

    /**
     * Query parameters for the wallet invocation URL. The presentation id stays on the verifier side.
     */
    public Map<String, String> toWalletRedirectParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", clientId);
        if (request != null) {
            params.put("request", request);
        }
        if (requestUri != null) {
            params.put("request_uri", requestUri);
        }
        return params;
    }

    private static boolean isAbsoluteUrl(String value) {
        try {
            URI uri = new URI(value);
            return uri.isAbsolute() && uri.getHost() != null;
        } catch (Exception e) {
            return false;
        }
    }

}
