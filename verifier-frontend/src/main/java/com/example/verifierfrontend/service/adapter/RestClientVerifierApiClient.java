package com.example.verifierfrontend.service.adapter;

import com.example.verifierfrontend.service.port.VerifierApiClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * {@link VerifierApiClient} on Spring's {@link RestClient}. Non-2xx responses surface as
 * {@link org.springframework.web.client.RestClientResponseException}, I/O problems as
 * {@link org.springframework.web.client.ResourceAccessException}.
 */
@Component
public class RestClientVerifierApiClient implements VerifierApiClient {

    private static final Logger logger = LoggerFactory.getLogger(RestClientVerifierApiClient.class);

    private final RestClient restClient;

    public RestClientVerifierApiClient(@Qualifier("verifierApiRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public JsonNode post(String baseUrl, String path, Object body) {
        URI uri = buildUri(baseUrl, path, Map.of());
        logger.debug("POST {}", uri);
        return restClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class);
    }

    @Override
    public JsonNode get(String baseUrl, String path, Map<String, String> queryParams) {
        URI uri = buildUri(baseUrl, path, queryParams);
        logger.debug("GET {}", uri.getPath());
        return restClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class);
    }

    /**
     * Path segments and query values are expanded as URI variables, so braces or reserved characters in an
     * identifier are encoded instead of being read as a template.
     */
    static URI buildUri(String baseUrl, String path, Map<String, String> queryParams) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl);
        Map<String, String> variables = new HashMap<>();

        String[] segments = StringUtils.tokenizeToStringArray(path, "/");
        for (int i = 0; i < segments.length; i++) {
            String name = "segment" + i;
            builder.pathSegment("{" + name + "}");
            variables.put(name, segments[i]);
        }
        if (queryParams != null) {
            queryParams.forEach((param, value) -> {
                String name = "query_" + param;
                builder.queryParam(param, "{" + name + "}");
                variables.put(name, value);
            });
        }
        return builder.encode().buildAndExpand(variables).toUri();
    }

}
