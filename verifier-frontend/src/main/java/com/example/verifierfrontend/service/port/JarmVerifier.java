package com.example.verifierfrontend.service.port;

import com.example.verifierfrontend.model.EphemeralEcdhPrivateJwk;
import com.example.verifierfrontend.model.JarmOption;
import com.example.verifierfrontend.model.JarmVerificationResult;

/**
 * Decrypts and/or verifies the JARM response posted by the wallet.
 * Verification problems are reported as {@link JarmVerificationResult.Failure}, not thrown.
 */
@FunctionalInterface
public interface JarmVerifier {

    JarmVerificationResult verify(JarmOption jarmOption, EphemeralEcdhPrivateJwk privateJwk, String response);

}
