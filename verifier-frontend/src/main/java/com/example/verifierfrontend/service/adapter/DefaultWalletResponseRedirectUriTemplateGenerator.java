package com.example.verifierfrontend.service.adapter;

import com.example.verifierfrontend.service.port.WalletResponseRedirectUriTemplateGenerator;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * {@code <baseUrl><path>?response_code=<placeholder>}. The path of the base URL is replaced and the
 * placeholder is left unencoded for the backend to substitute.
 */
@Component
public class DefaultWalletResponseRedirectUriTemplateGenerator implements WalletResponseRedirectUriTemplateGenerator {

    static final String RESPONSE_CODE_PARAM = "response_code";

    @Override
    public String generate(String baseUrl, String path, String placeholder) {
        Assert.hasText(baseUrl, "Base URL must not be empty");
        Assert.hasText(path, "Path must not be empty");
        Assert.hasText(placeholder, "Placeholder must not be empty");

        String template = UriComponentsBuilder.fromUriString(baseUrl)
                .replacePath(path)
                .replaceQuery(null)
                .fragment(null)
                .build()
                .toUriString();
        // appended by hand: the builder would treat {RESPONSE_CODE} as a URI variable
        return template + "?" + RESPONSE_CODE_PARAM + "=" + placeholder;
    }

}
