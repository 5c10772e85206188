package com.example.verifierfrontend.controller;

import com.example.verifierfrontend.exception.GetWalletResponseServiceException;
import com.example.verifierfrontend.exception.InitTransactionServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the two phases' classified failures to HTTP responses.
 */
@RestControllerAdvice
public class VerifierFrontendExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(VerifierFrontendExceptionHandler.class);

    @ExceptionHandler(InitTransactionServiceException.class)
    public ResponseEntity<ErrorResponse> handleInitTransaction(InitTransactionServiceException exception) {
        HttpStatus status = switch (exception.getErrorType()) {
            case MISSING_USER_AGENT -> HttpStatus.BAD_REQUEST;
            case INVALID_RESPONSE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case API_REQUEST_FAILED -> HttpStatus.BAD_GATEWAY;
            case SESSION_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return toResponse(status, exception.getErrorType().name(), exception.getDetails(), exception);
    }

    @ExceptionHandler(GetWalletResponseServiceException.class)
    public ResponseEntity<ErrorResponse> handleGetWalletResponse(GetWalletResponseServiceException exception) {
        HttpStatus status = switch (exception.getErrorType()) {
            case MISSING_PRESENTATION_ID, MISSING_EPHEMERAL_ECDH_PRIVATE_JWK -> HttpStatus.NOT_FOUND;
            case MISSING_VP_TOKEN, INVALID_RESPONSE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case API_REQUEST_FAILED -> HttpStatus.BAD_GATEWAY;
            case SESSION_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return toResponse(status, exception.getErrorType().name(), exception.getDetails(), exception);
    }

    private static ResponseEntity<ErrorResponse> toResponse(HttpStatus status, String error, String description,
                                                            Exception exception) {
        if (status.is5xxServerError()) {
            logger.error("{} -> {}", error, status, exception);
        } else {
            logger.debug("{} -> {}: {}", error, status, description);
        }
        return ResponseEntity.status(status).body(new ErrorResponse(error.toLowerCase(), description));
    }

}
