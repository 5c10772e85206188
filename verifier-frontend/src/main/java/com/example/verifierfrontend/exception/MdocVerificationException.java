package com.example.verifierfrontend.exception;

/**
 * Technical failure of mDoc verification (undecodable token), as opposed to a credential that fails checks.
 */
public class MdocVerificationException extends RuntimeException {

    public MdocVerificationException(String message) {
        super(message);
    }

    public MdocVerificationException(String message, Throwable cause) {
        super(message, cause);
    }

}
