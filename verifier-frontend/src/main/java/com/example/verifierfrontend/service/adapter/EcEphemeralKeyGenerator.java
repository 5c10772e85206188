package com.example.verifierfrontend.service.adapter;

import com.example.verifierfrontend.model.EphemeralEcdhPrivateJwk;
import com.example.verifierfrontend.model.JarmOption;
import com.example.verifierfrontend.service.port.EphemeralKeyGenerator;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWEAlgorithm;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Generates a P-256 key for ECDH-ES key agreement. The JWE algorithm of the configured
 * {@link JarmOption}, if any, is advertised as the key's "alg".
 */
@Component
public class EcEphemeralKeyGenerator implements EphemeralKeyGenerator {

    private final JWEAlgorithm algorithm;

    public EcEphemeralKeyGenerator(JarmOption jarmOption) {
        this.algorithm = jarmOption.jweAlg().map(JWEAlgorithm::parse).orElse(null);
    }

    @Override
    public EphemeralEcdhPrivateJwk generate() {
        try {
            ECKey key = new ECKeyGenerator(Curve.P_256)
                    .keyUse(KeyUse.ENCRYPTION)
                    .keyID(UUID.randomUUID().toString())
                    .algorithm(algorithm)
                    .generate();
            return EphemeralEcdhPrivateJwk.of(key);
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to generate ephemeral ECDH key", e);
        }
    }

}
