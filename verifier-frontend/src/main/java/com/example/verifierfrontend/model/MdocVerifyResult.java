package com.example.verifierfrontend.model;

import java.util.List;

/**
 * Result of mDoc verification. {@code valid=false} is a normal outcome, not an error.
 */
public record MdocVerifyResult(boolean valid, List<MdocDocument> documents) {

    public MdocVerifyResult {
        documents = documents == null ? List.of() : List.copyOf(documents);
    }

    public static MdocVerifyResult invalid() {
        return new MdocVerifyResult(false, List.of());
    }

}
