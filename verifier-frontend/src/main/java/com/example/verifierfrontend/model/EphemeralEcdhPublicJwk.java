package com.example.verifierfrontend.model;

import com.nimbusds.jose.jwk.ECKey;
import org.springframework.util.Assert;

import java.text.ParseException;

/**
 * Public half of the per-transaction ECDH key as JWK JSON. The wallet encrypts its response to this key.
 *
 * @param value JWK JSON without private parameters
 */
public record EphemeralEcdhPublicJwk(String value) {

    public EphemeralEcdhPublicJwk {
        Assert.hasText(value, "Ephemeral ECDH public JWK must not be empty");
        try {
            Assert.isTrue(!ECKey.parse(value).isPrivate(), "Ephemeral ECDH public JWK must not contain the private key");
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid ephemeral ECDH JWK: " + e.getMessage(), e);
        }
    }

}
