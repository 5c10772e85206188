package com.example.verifierfrontend.model;

/**
 * Authorization response recovered from a verified JARM payload. Every field is optional.
 */
public record AuthorizationResponse(
        String vpToken,
        String idToken,
        String error,
        String errorDescription,
        String state
) {
}
