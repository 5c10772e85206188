package com.example.verifierfrontend.service.port;

import com.example.verifierfrontend.model.EphemeralEcdhPrivateJwk;

/**
 * Mints a fresh ECDH key pair for one transaction.
 */
@FunctionalInterface
public interface EphemeralKeyGenerator {

    EphemeralEcdhPrivateJwk generate();

}
