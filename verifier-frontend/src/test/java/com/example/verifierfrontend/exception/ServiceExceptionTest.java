package com.example.verifierfrontend.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceExceptionTest {

    @Test
    void messageCarriesPhaseTypeAndDetails() {
        InitTransactionServiceException init = new InitTransactionServiceException(
                InitTransactionServiceException.ErrorType.MISSING_USER_AGENT, "no UA");
        GetWalletResponseServiceException get = new GetWalletResponseServiceException(
                GetWalletResponseServiceException.ErrorType.MISSING_VP_TOKEN, "no token");

        assertThat(init.getMessage()).isEqualTo("InitTransaction Service Error (MISSING_USER_AGENT): no UA");
        assertThat(get.getMessage()).isEqualTo("GetWalletResponse Service Error (MISSING_VP_TOKEN): no token");
        assertThat(get.getDetails()).isEqualTo("no token");
    }

    @Test
    void wrapKeepsClassifiedExceptions() {
        InitTransactionServiceException classified = new InitTransactionServiceException(
                InitTransactionServiceException.ErrorType.SESSION_ERROR, "store failed");

        assertThat(InitTransactionServiceException.wrap(classified,
                InitTransactionServiceException.ErrorType.API_REQUEST_FAILED, "unexpected")).isSameAs(classified);
    }

    @Test
    void wrapClassifiesForeignExceptionsWithCause() {
        IllegalStateException cause = new IllegalStateException("boom");

        GetWalletResponseServiceException wrapped = GetWalletResponseServiceException.wrap(cause,
                GetWalletResponseServiceException.ErrorType.API_REQUEST_FAILED, "Unexpected error");

        assertThat(wrapped.getErrorType()).isEqualTo(GetWalletResponseServiceException.ErrorType.API_REQUEST_FAILED);
        assertThat(wrapped.getCause()).isSameAs(cause);
    }

}
