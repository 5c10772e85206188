package com.example.verifierfrontend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResponseMode {

    DIRECT_POST("direct_post"),
    DIRECT_POST_JWT("direct_post.jwt");

    private final String value;

    ResponseMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

}
