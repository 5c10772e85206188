package com.example.verifierfrontend.exception;

/**
 * Failure while retrieving or verifying the wallet response of a transaction.
 */
public class GetWalletResponseServiceException extends RuntimeException {

    public enum ErrorType {
        MISSING_PRESENTATION_ID,
        MISSING_VP_TOKEN,
        API_REQUEST_FAILED,
        INVALID_RESPONSE,
        SESSION_ERROR,
        MISSING_EPHEMERAL_ECDH_PRIVATE_JWK
    }

    private final ErrorType errorType;
    private final String details;

    public GetWalletResponseServiceException(ErrorType errorType, String details) {
        this(errorType, details, null);
    }

    public GetWalletResponseServiceException(ErrorType errorType, String details, Throwable cause) {
        super("GetWalletResponse Service Error (" + errorType + "): " + details, cause);
        this.errorType = errorType;
        this.details = details;
    }

    /**
     * Returns {@code error} itself if it is already classified, otherwise wraps it with the given type.
     */
    public static GetWalletResponseServiceException wrap(Throwable error, ErrorType fallback, String details) {
        if (error instanceof GetWalletResponseServiceException classified) {
            return classified;
        }
        return new GetWalletResponseServiceException(fallback, details, error);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getDetails() {
        return details;
    }

}
