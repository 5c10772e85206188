package com.example.verifierfrontend.model;

import java.util.Optional;

/**
 * Outcome of JARM verification. Failures are values so callers decide how fatal they are.
 */
public sealed interface JarmVerificationResult {

    record Success(AuthorizationResponse authorizationResponse) implements JarmVerificationResult {}

    record Failure(String reason, Exception cause) implements JarmVerificationResult {}

    default Optional<AuthorizationResponse> asAuthorizationResponse() {
        if (this instanceof Success success) {
            return Optional.ofNullable(success.authorizationResponse());
        }
        return Optional.empty();
    }

}
