package com.example.verifierfrontend.service.adapter;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WalletUriGeneratorsTest {

    private final DefaultWalletResponseRedirectUriTemplateGenerator templateGenerator =
            new DefaultWalletResponseRedirectUriTemplateGenerator();
    private final DefaultWalletRedirectUriGenerator redirectGenerator = new DefaultWalletRedirectUriGenerator();

    @Test
    void templateReplacesPathAndQueryOfBaseUrl() {
        String template = templateGenerator.generate("https://frontend.example/app?x=1", "/result", "{RESPONSE_CODE}");

        assertThat(template).isEqualTo("https://frontend.example/result?response_code={RESPONSE_CODE}");
    }

    @Test
    void templateRequiresPlaceholder() {
        assertThatThrownBy(() -> templateGenerator.generate("https://frontend.example", "/result", " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void redirectUriCarriesEncodedRequestParameters() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", "verifier.example");
        params.put("request_uri", "https://backend.example/wallet/request.jwt/abc?x=1&y=2");
        params.put("request", null);

        String uri = redirectGenerator.generate("https://wallet.example/authorize?old=1", params);

        assertThat(uri).startsWith("https://wallet.example/authorize?client_id=verifier.example&request_uri=");
        assertThat(uri).contains("request_uri=https%3A%2F%2Fbackend.example%2Fwallet%2Frequest.jwt%2Fabc%3Fx%3D1%26y%3D2");
        assertThat(uri).doesNotContain("old=1").doesNotContain("request=");
    }

    @Test
    void redirectUriKeepsCustomSchemeWalletUrl() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", "verifier.example");
        params.put("request_uri", "https://backend.example/wallet/request.jwt/abc");

        String uri = redirectGenerator.generate("eudi-openid4vp://", params);

        assertThat(uri).startsWith("eudi-openid4vp://");
        assertThat(uri).isEqualTo("eudi-openid4vp://?client_id=verifier.example"
                + "&request_uri=https%3A%2F%2Fbackend.example%2Fwallet%2Frequest.jwt%2Fabc");
    }

    @Test
    void redirectUriDropsFragmentOfWalletUrl() {
        String uri = redirectGenerator.generate("https://wallet.example/authorize#start",
                Map.of("client_id", "verifier.example"));

        assertThat(uri).isEqualTo("https://wallet.example/authorize?client_id=verifier.example");
    }

    @Test
    void redirectUriWithoutParametersIsWalletUrl() {
        assertThat(redirectGenerator.generate("eudi-openid4vp://", Map.of())).isEqualTo("eudi-openid4vp://");
    }

}
