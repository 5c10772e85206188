package com.example.verifierfrontend.service.adapter;

import com.example.verifierfrontend.model.AuthorizationResponse;
import com.example.verifierfrontend.model.EphemeralEcdhPrivateJwk;
import com.example.verifierfrontend.model.JarmOption;
import com.example.verifierfrontend.model.JarmVerificationResult;
import com.example.verifierfrontend.service.port.JarmVerifier;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWEHeader;
import com.nimbusds.jose.JWEObject;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.ECDHDecrypter;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.KeyType;
import com.nimbusds.jose.util.Base64;
import com.nimbusds.jose.util.X509CertUtils;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.security.PublicKey;
import java.security.cert.X509Certificate;
import java.text.ParseException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JARM response handling with Nimbus JOSE+JWT.
 *
 * <ul>
 *   <li>Encrypted: JWE decrypted with the transaction's ephemeral ECDH private key</li>
 *   <li>Signed: JWS verified with the key in its {@code jwk} or {@code x5c} header</li>
 *   <li>Signed and encrypted: decrypt, then verify the nested JWS</li>
 * </ul>
 * The JOSE header algorithms must match the configured {@link JarmOption}.
 */
@Component
public class NimbusJarmVerifier implements JarmVerifier {

    private static final Logger logger = LoggerFactory.getLogger(NimbusJarmVerifier.class);

    @Override
    public JarmVerificationResult verify(JarmOption jarmOption, EphemeralEcdhPrivateJwk privateJwk, String response) {
        try {
            Assert.hasText(response, "JARM response must not be empty");
            JWTClaimsSet claims = unwrap(jarmOption, privateJwk, response.trim());
            AuthorizationResponse authorizationResponse = toAuthorizationResponse(claims);
            logger.debug("JARM response verified: vp_token present={}, id_token present={}",
                    authorizationResponse.vpToken() != null, authorizationResponse.idToken() != null);
            return new JarmVerificationResult.Success(authorizationResponse);
        } catch (ParseException | JOSEException | IllegalArgumentException e) {
            logger.debug("JARM verification failed", e);
            return new JarmVerificationResult.Failure(e.getMessage(), e);
        }
    }

    private JWTClaimsSet unwrap(JarmOption jarmOption, EphemeralEcdhPrivateJwk privateJwk, String response)
            throws ParseException, JOSEException {
        if (jarmOption instanceof JarmOption.Signed signed) {
            return verifySignature(signed, SignedJWT.parse(response));
        } else if (jarmOption instanceof JarmOption.Encrypted encrypted) {
            JWEObject jwe = decrypt(encrypted, privateJwk, response);
            Map<String, Object> json = jwe.getPayload().toJSONObject();
            Assert.notNull(json, "Decrypted JARM payload is not a JSON object");
            return JWTClaimsSet.parse(json);
        } else if (jarmOption instanceof JarmOption.SignedAndEncrypted both) {
            JWEObject jwe = decrypt(both.encrypted(), privateJwk, response);
            SignedJWT nested = jwe.getPayload().toSignedJWT();
            if (nested == null) {
                nested = SignedJWT.parse(jwe.getPayload().toString());
            }
            return verifySignature(both.signed(), nested);
        }
        throw new IllegalArgumentException("Unsupported JARM option: " + jarmOption);
    }

    private static JWEObject decrypt(JarmOption.Encrypted option, EphemeralEcdhPrivateJwk privateJwk, String response)
            throws ParseException, JOSEException {
        Assert.notNull(privateJwk, "Ephemeral ECDH private key is required to decrypt the JARM response");

        JWEObject jwe = JWEObject.parse(response);
        JWEHeader header = jwe.getHeader();
        Assert.isTrue(option.algorithm().equals(header.getAlgorithm().getName()),
                "Unexpected JWE algorithm: " + header.getAlgorithm());
        Assert.isTrue(option.encMethod().equals(header.getEncryptionMethod().getName()),
                "Unexpected JWE encryption method: " + header.getEncryptionMethod());

        jwe.decrypt(new ECDHDecrypter(privateJwk.toECKey()));
        return jwe;
    }

    private static JWTClaimsSet verifySignature(JarmOption.Signed option, SignedJWT jwt)
            throws ParseException, JOSEException {
        Assert.isTrue(option.algorithm().equals(jwt.getHeader().getAlgorithm().getName()),
                "Unexpected JWS algorithm: " + jwt.getHeader().getAlgorithm());

        JWK signingKey = resolveSigningKey(jwt);
        JWSVerifier verifier = new DefaultJWSVerifierFactory().createJWSVerifier(jwt.getHeader(), toPublicKey(signingKey));
        Assert.isTrue(jwt.verify(verifier), "JARM signature verification failed");
        return jwt.getJWTClaimsSet();
    }

    private static JWK resolveSigningKey(SignedJWT jwt) throws JOSEException {
        if (jwt.getHeader().getJWK() != null) {
            return jwt.getHeader().getJWK();
        }
        List<Base64> x5c = jwt.getHeader().getX509CertChain();
        if (x5c != null && !x5c.isEmpty()) {
            X509Certificate leaf = X509CertUtils.parse(x5c.get(0).decode());
            Assert.notNull(leaf, "x5c header does not contain a valid certificate");
            return JWK.parse(leaf);
        }
        throw new IllegalArgumentException("Signed JARM response carries neither jwk nor x5c header");
    }

    private static PublicKey toPublicKey(JWK jwk) throws JOSEException {
        KeyType keyType = jwk.getKeyType();
        if (KeyType.EC.equals(keyType)) {
            return jwk.toECKey().toPublicKey();
        } else if (KeyType.RSA.equals(keyType)) {
            return jwk.toRSAKey().toPublicKey();
        } else if (KeyType.OKP.equals(keyType)) {
            return jwk.toOctetKeyPair().toPublicKey();
        }
        throw new JOSEException(String.format("The key type '%s' is not supported.", keyType));
    }

    private static AuthorizationResponse toAuthorizationResponse(JWTClaimsSet claims) throws ParseException {
        return new AuthorizationResponse(
                extractVpToken(claims.getClaim("vp_token")).orElse(null),
                claims.getStringClaim("id_token"),
                claims.getStringClaim("error"),
                claims.getStringClaim("error_description"),
                claims.getStringClaim("state")
        );
    }

    /**
     * vp_token is a string, an array of presentations, or (DCQL) an object keyed by query id.
     * Only the first presentation is returned.
     */
    static Optional<String> extractVpToken(Object vpToken) {
        if (vpToken instanceof String token) {
            return Optional.of(token).filter(StringUtils::hasText);
        } else if (vpToken instanceof Collection<?> tokens) {
            return tokens.stream().filter(Objects::nonNull).findFirst().flatMap(NimbusJarmVerifier::extractVpToken);
        } else if (vpToken instanceof Map<?, ?> byQueryId) {
            return byQueryId.values().stream().filter(Objects::nonNull).findFirst().flatMap(NimbusJarmVerifier::extractVpToken);
        }
        return Optional.empty();
    }

}
