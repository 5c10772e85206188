package com.example.verifierfrontend.model;

import org.springframework.util.Assert;

import java.io.Serializable;

/**
 * Identifier the verifier backend assigns to a transaction. Correlates the init call with the later
 * wallet response lookup.
 *
 * @param value the presentation id, never empty
 */
public record PresentationId(String value) implements Serializable {

    public PresentationId {
        Assert.hasLength(value, "Presentation ID must not be empty");
    }

}
