package com.example.verifierfrontend.service.adapter;

import com.example.verifierfrontend.service.port.WalletRedirectUriGenerator;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Appends the authorization request parameters to the wallet URL, replacing any query or fragment it already has.
 * Null values are left out; values are percent-encoded.
 */
@Component
public class DefaultWalletRedirectUriGenerator implements WalletRedirectUriGenerator {

    @Override
    public String generate(String walletUrl, Map<String, String> queryParams) {
        Assert.hasText(walletUrl, "Wallet URL must not be empty");

        // the wallet URL is kept as configured: custom schemes like eudi-openid4vp:// have an empty authority
        String base = stripQueryAndFragment(walletUrl.trim());

        UriComponentsBuilder query = UriComponentsBuilder.newInstance();
        boolean hasParams = false;
        if (queryParams != null) {
            for (Map.Entry<String, String> param : queryParams.entrySet()) {
                if (param.getValue() != null) {
                    query.queryParam(param.getKey(), "{" + param.getKey() + "}");
                    hasParams = true;
                }
            }
        }
        if (!hasParams) {
            return base;
        }
        return base + query.encode().buildAndExpand(queryParams).toUriString();
    }

    private static String stripQueryAndFragment(String url) {
        int end = url.length();
        int queryStart = url.indexOf('?');
        int fragmentStart = url.indexOf('#');
        if (queryStart >= 0) {
            end = queryStart;
        }
        if (fragmentStart >= 0 && fragmentStart < end) {
            end = fragmentStart;
        }
        return url.substring(0, end);
    }

}
