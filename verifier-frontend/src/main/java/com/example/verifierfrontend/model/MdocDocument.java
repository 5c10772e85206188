package com.example.verifierfrontend.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A verified mDoc document with its disclosed claims grouped by namespace.
 */
public record MdocDocument(
        @JsonProperty("doc_type") String docType,
        @JsonProperty("claims") Map<String, Map<String, Object>> claims
) {
}
