package com.example.verifierfrontend.service.port;

import com.example.verifierfrontend.model.MdocVerifyResult;

/**
 * Verifies an mDoc DeviceResponse carried in a VP token.
 * A credential failing its checks yields {@code valid=false}; exceptions are reserved for tokens
 * that cannot be processed at all.
 */
@FunctionalInterface
public interface MdocVerifier {

    MdocVerifyResult verify(String vpToken);

}
