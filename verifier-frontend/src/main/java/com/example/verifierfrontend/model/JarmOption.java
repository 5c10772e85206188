package com.example.verifierfrontend.model;

import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * How the wallet protects its authorization response (JARM): signed, encrypted, or signed then encrypted.
 * The accessors expose only the algorithm identifiers that apply to the variant.
 */
public sealed interface JarmOption permits JarmOption.Signed, JarmOption.Encrypted, JarmOption.SignedAndEncrypted {

    record Signed(String algorithm) implements JarmOption {
        public Signed {
            Assert.hasText(algorithm, "JWS algorithm must not be empty");
        }
    }

    record Encrypted(String algorithm, String encMethod) implements JarmOption {
        public Encrypted {
            Assert.hasText(algorithm, "JWE algorithm must not be empty");
            Assert.hasText(encMethod, "JWE encryption method must not be empty");
        }
    }

    record SignedAndEncrypted(Signed signed, Encrypted encrypted) implements JarmOption {
        public SignedAndEncrypted {
            Assert.notNull(signed, "Signed option must not be null");
            Assert.notNull(encrypted, "Encrypted option must not be null");
        }
    }

    default Optional<String> jwsAlg() {
        if (this instanceof Signed signed) {
            return Optional.of(signed.algorithm());
        } else if (this instanceof Encrypted) {
            return Optional.empty();
        } else if (this instanceof SignedAndEncrypted both) {
            return both.signed().jwsAlg();
        }
        throw new IllegalStateException("Unknown JARM option: " + this);
    }

    default Optional<String> jweAlg() {
        if (this instanceof Signed) {
            return Optional.empty();
        } else if (this instanceof Encrypted encrypted) {
            return Optional.of(encrypted.algorithm());
        } else if (this instanceof SignedAndEncrypted both) {
            return both.encrypted().jweAlg();
        }
        throw new IllegalStateException("Unknown JARM option: " + this);
    }

    default Optional<String> jweEnc() {
        if (this instanceof Signed) {
            return Optional.empty();
        } else if (this instanceof Encrypted encrypted) {
            return Optional.of(encrypted.encMethod());
        } else if (this instanceof SignedAndEncrypted both) {
            return both.encrypted().jweEnc();
        }
        throw new IllegalStateException("Unknown JARM option: " + this);
    }

    /**
     * Builds the option from the client metadata style settings
     * (authorization_signed_response_alg, authorization_encrypted_response_alg/enc).
     *
     * @return empty when neither signing nor encryption is configured
     * @throws IllegalArgumentException if only one of the encryption alg/enc pair is set
     */
    static Optional<JarmOption> parse(String signedResponseAlg, String encryptedResponseAlg, String encryptedResponseEnc) {
        Signed signed = StringUtils.hasText(signedResponseAlg) ? new Signed(signedResponseAlg) : null;

        boolean hasAlg = StringUtils.hasText(encryptedResponseAlg);
        boolean hasEnc = StringUtils.hasText(encryptedResponseEnc);
        if (hasAlg != hasEnc) {
            throw new IllegalArgumentException(
                    "Encrypted response requires both alg and enc, got alg=" + encryptedResponseAlg + ", enc=" + encryptedResponseEnc);
        }
        Encrypted encrypted = hasAlg ? new Encrypted(encryptedResponseAlg, encryptedResponseEnc) : null;

        if (signed != null && encrypted != null) {
            return Optional.of(new SignedAndEncrypted(signed, encrypted));
        }
        return Optional.ofNullable(signed != null ? signed : encrypted);
    }

}
