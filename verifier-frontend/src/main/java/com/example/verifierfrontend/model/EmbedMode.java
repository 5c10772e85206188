package com.example.verifierfrontend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether the request object (jar_mode) or the presentation definition is passed inline or by URI.
 */
public enum EmbedMode {

    BY_VALUE("by_value"),
    BY_REFERENCE("by_reference");

    private final String value;

    EmbedMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

}
