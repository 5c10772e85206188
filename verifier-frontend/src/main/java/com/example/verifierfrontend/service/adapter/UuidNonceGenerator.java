package com.example.verifierfrontend.service.adapter;

import com.example.verifierfrontend.model.Nonce;
import com.example.verifierfrontend.service.port.NonceGenerator;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class UuidNonceGenerator implements NonceGenerator {

    @Override
    public Nonce generate() {
        return new Nonce(UUID.randomUUID().toString());
    }

}
