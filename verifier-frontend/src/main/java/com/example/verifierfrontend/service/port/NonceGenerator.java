package com.example.verifierfrontend.service.port;

import com.example.verifierfrontend.model.Nonce;

@FunctionalInterface
public interface NonceGenerator {

    Nonce generate();

}
