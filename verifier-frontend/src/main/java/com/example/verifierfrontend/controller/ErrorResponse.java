package com.example.verifierfrontend.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OAuth style error body.
 */
public record ErrorResponse(
        @JsonProperty("error") String error,
        @JsonProperty("error_description") String errorDescription
) {
}
