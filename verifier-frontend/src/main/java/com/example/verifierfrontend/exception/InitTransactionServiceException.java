package com.example.verifierfrontend.exception;

/**
 * Failure while initiating a presentation transaction. The error type is one of a closed set so that
 * callers can map it without inspecting causes.
 */
public class InitTransactionServiceException extends RuntimeException {

    public enum ErrorType {
        MISSING_USER_AGENT,
        API_REQUEST_FAILED,
        INVALID_RESPONSE,
        SESSION_ERROR
    }

    private final ErrorType errorType;
    private final String details;

    public InitTransactionServiceException(ErrorType errorType, String details) {
        this(errorType, details, null);
    }

    public InitTransactionServiceException(ErrorType errorType, String details, Throwable cause) {
        super("InitTransaction Service Error (" + errorType + "): " + details, cause);
        this.errorType = errorType;
        this.details = details;
    }

    /**
     * Returns {@code error} itself if it is already classified, otherwise wraps it with the given type.
     */
    public static InitTransactionServiceException wrap(Throwable error, ErrorType fallback, String details) {
        if (error instanceof InitTransactionServiceException classified) {
            return classified;
        }
        return new InitTransactionServiceException(fallback, details, error);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getDetails() {
        return details;
    }

}
