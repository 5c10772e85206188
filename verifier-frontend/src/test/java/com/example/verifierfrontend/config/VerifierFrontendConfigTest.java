package com.example.verifierfrontend.config;

import com.example.verifierfrontend.model.JarmOption;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerifierFrontendConfigTest {

    private final VerifierFrontendConfig config = new VerifierFrontendConfig();

    @Test
    void defaultsToEncryptedResponses() {
        JarmOption jarmOption = config.jarmOption(new AppConfig());

        assertThat(jarmOption).isEqualTo(new JarmOption.Encrypted("ECDH-ES+A256KW", "A256GCM"));
    }

    @Test
    void signedAndEncryptedWhenBothConfigured() {
        AppConfig appConfig = new AppConfig();
        appConfig.setAuthorizationSignedResponseAlg("ES256");

        assertThat(config.jarmOption(appConfig)).isInstanceOf(JarmOption.SignedAndEncrypted.class);
    }

    @Test
    void failsWithoutAnyJarmSetting() {
        AppConfig appConfig = new AppConfig();
        appConfig.setAuthorizationEncryptedResponseAlg(null);
        appConfig.setAuthorizationEncryptedResponseEnc(null);

        assertThatThrownBy(() -> config.jarmOption(appConfig))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No JARM option configured");
    }

}
