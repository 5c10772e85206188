package com.example.verifierfrontend.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final output of phase two: the mDoc verification outcome plus the VP token it was computed from.
 */
public record VerificationResult(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("documents") List<MdocDocument> documents,
        @JsonProperty("vp_token") String vpToken
) {
}
