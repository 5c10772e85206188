package com.example.verifierfrontend.model;

import com.nimbusds.jose.jwk.ECKey;
import org.springframework.util.Assert;

import java.io.Serializable;
import java.text.ParseException;

/**
 * Private half of the per-transaction ECDH key, serialized as a JWK JSON string.
 * It is kept in the transaction session and used once to decrypt the wallet's JARM response.
 * Only {@link #derivePublic()} may leave the verifier.
 *
 * @param value JWK JSON including the private "d" parameter
 */
public record EphemeralEcdhPrivateJwk(String value) implements Serializable {

    public EphemeralEcdhPrivateJwk {
        Assert.hasText(value, "Ephemeral ECDH private JWK must not be empty");
        Assert.isTrue(parse(value).isPrivate(), "Ephemeral ECDH private JWK must contain the private key");
    }

    public static EphemeralEcdhPrivateJwk of(ECKey key) {
        Assert.isTrue(key.isPrivate(), "Ephemeral ECDH key must contain the private key");
        return new EphemeralEcdhPrivateJwk(key.toJSONString());
    }

    public ECKey toECKey() {
        return parse(value);
    }

    /**
     * Strips the private parameters and returns the half that is sent to the verifier backend.
     */
    public EphemeralEcdhPublicJwk derivePublic() {
        return new EphemeralEcdhPublicJwk(toECKey().toPublicJWK().toJSONString());
    }

    @Override
    public String toString() {
        return "EphemeralEcdhPrivateJwk[***]";
    }

    private static ECKey parse(String json) {
        try {
            return ECKey.parse(json);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid ephemeral ECDH JWK: " + e.getMessage(), e);
        }
    }

}
