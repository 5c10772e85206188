package com.example.verifierfrontend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The "type" of an init transaction request: which tokens the wallet must return.
 */
public enum PresentationType {

    ID_TOKEN("id_token"),
    VP_TOKEN("vp_token"),
    ID_TOKEN_VP_TOKEN("id_token vp_token");

    private final String value;

    PresentationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

}
