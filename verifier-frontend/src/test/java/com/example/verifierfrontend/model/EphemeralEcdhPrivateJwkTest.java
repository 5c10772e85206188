package com.example.verifierfrontend.model;

import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EphemeralEcdhPrivateJwkTest {

    private ECKey key;

    @BeforeEach
    void setUp() throws Exception {
        key = new ECKeyGenerator(Curve.P_256).keyID("k1").generate();
    }

    @Test
    void derivePublicDropsPrivateParameter() throws Exception {
        EphemeralEcdhPrivateJwk privateJwk = EphemeralEcdhPrivateJwk.of(key);

        EphemeralEcdhPublicJwk publicJwk = privateJwk.derivePublic();

        ECKey parsed = ECKey.parse(publicJwk.value());
        assertThat(parsed.isPrivate()).isFalse();
        assertThat(parsed.getKeyID()).isEqualTo("k1");
        assertThat(parsed.getX()).isEqualTo(key.getX());
        assertThat(publicJwk.value()).doesNotContain("\"d\"");
    }

    @Test
    void toECKeyRestoresPrivateKey() {
        EphemeralEcdhPrivateJwk privateJwk = new EphemeralEcdhPrivateJwk(key.toJSONString());

        assertThat(privateJwk.toECKey().isPrivate()).isTrue();
        assertThat(privateJwk.toECKey().getD()).isEqualTo(key.getD());
    }

    @Test
    void rejectsPublicOnlyOrMalformedJwk() {
        String publicOnly = key.toPublicJWK().toJSONString();

        assertThatThrownBy(() -> new EphemeralEcdhPrivateJwk(publicOnly)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EphemeralEcdhPrivateJwk("{not json")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EphemeralEcdhPrivateJwk("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void publicJwkRejectsPrivateKey() {
        assertThatThrownBy(() -> new EphemeralEcdhPublicJwk(key.toJSONString()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toStringDoesNotLeakKeyMaterial() {
        EphemeralEcdhPrivateJwk privateJwk = EphemeralEcdhPrivateJwk.of(key);

        assertThat(privateJwk.toString()).doesNotContain(key.getD().toString());
    }

}
