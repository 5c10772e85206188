package com.example.verifierfrontend.model;

import org.springframework.util.Assert;

import java.io.Serializable;

/**
 * Single-use random value binding an authorization request to the wallet's response.
 *
 * @param value the nonce, never empty
 */
public record Nonce(String value) implements Serializable {

    public Nonce {
        Assert.hasLength(value, "Nonce must not be empty");
    }

}
