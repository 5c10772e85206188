package com.example.verifierfrontend.service;

import com.example.verifierfrontend.config.AppConfig;
import com.example.verifierfrontend.exception.GetWalletResponseServiceException;
import com.example.verifierfrontend.exception.GetWalletResponseServiceException.ErrorType;
import com.example.verifierfrontend.model.AuthorizationResponse;
import com.example.verifierfrontend.model.EphemeralEcdhPrivateJwk;
import com.example.verifierfrontend.model.JarmOption;
import com.example.verifierfrontend.model.JarmVerificationResult;
import com.example.verifierfrontend.model.MdocVerifyResult;
import com.example.verifierfrontend.model.PresentationId;
import com.example.verifierfrontend.model.VerificationResult;
import com.example.verifierfrontend.model.WalletResponse;
import com.example.verifierfrontend.service.port.JarmVerifier;
import com.example.verifierfrontend.service.port.MdocVerifier;
import com.example.verifierfrontend.service.port.VerifierApiClient;
import com.example.verifierfrontend.session.SessionKey;
import com.example.verifierfrontend.session.TransactionSession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.Serializable;
import java.util.Map;
import java.util.Optional;

/**
 * Phase two of the presentation flow: fetches the wallet's JARM response for the transaction in the
 * session, unwraps it with the ephemeral key and verifies the mDoc VP token.
 */
@Service
public class GetWalletResponseService {

    private static final Logger logger = LoggerFactory.getLogger(GetWalletResponseService.class);

    static final String RESPONSE_CODE_PARAM = "response_code";

    private final AppConfig appConfig;
    private final VerifierApiClient verifierApiClient;
    private final JarmVerifier jarmVerifier;
    private final MdocVerifier mdocVerifier;
    private final JarmOption jarmOption;
    private final ObjectMapper objectMapper;

    public GetWalletResponseService(AppConfig appConfig,
                                    VerifierApiClient verifierApiClient,
                                    JarmVerifier jarmVerifier,
                                    MdocVerifier mdocVerifier,
                                    JarmOption jarmOption,
                                    ObjectMapper objectMapper) {
        if (!StringUtils.hasText(appConfig.getApiBaseUrl())
                || !StringUtils.hasText(appConfig.getGetWalletResponseApiPath())
                || jarmOption == null) {
            throw new GetWalletResponseServiceException(ErrorType.INVALID_RESPONSE,
                    "Required configuration parameters are missing");
        }
        this.appConfig = appConfig;
        this.verifierApiClient = verifierApiClient;
        this.jarmVerifier = jarmVerifier;
        this.mdocVerifier = mdocVerifier;
        this.jarmOption = jarmOption;
        this.objectMapper = objectMapper;
    }

    /**
     * Retrieves and verifies the wallet response of the transaction held in {@code session}.
     *
     * @param responseCode code the wallet appended to the redirect URI (same-device flow), may be null
     * @param session      the caller's transaction session
     * @return the mDoc verification outcome; {@code valid=false} is returned, not thrown
     * @throws GetWalletResponseServiceException for every failure, classified by {@link ErrorType}
     */
    public VerificationResult getWalletResponse(String responseCode, TransactionSession session) {
        try {
            PresentationId presentationId = loadPresentationId(session);

            Map<String, String> queryParams = StringUtils.hasText(responseCode)
                    ? Map.of(RESPONSE_CODE_PARAM, responseCode)
                    : Map.of();
            String path = appConfig.getGetWalletResponseApiPath() + "/" + presentationId.value();

            JsonNode data;
            try {
                data = verifierApiClient.get(appConfig.getApiBaseUrl(), path, queryParams);
            } catch (RuntimeException e) {
                throw new GetWalletResponseServiceException(ErrorType.API_REQUEST_FAILED,
                        "Failed to communicate with GetWalletResponse API", e);
            }

            WalletResponse walletResponse;
            try {
                walletResponse = WalletResponse.fromJson(data, objectMapper);
            } catch (Exception e) {
                throw new GetWalletResponseServiceException(ErrorType.INVALID_RESPONSE,
                        "Failed to parse GetWalletResponse API response", e);
            }

            EphemeralEcdhPrivateJwk privateJwk = read(session, SessionKey.EPHEMERAL_ECDH_PRIVATE_JWK)
                    .orElseThrow(() -> new GetWalletResponseServiceException(ErrorType.MISSING_EPHEMERAL_ECDH_PRIVATE_JWK,
                            "Ephemeral ECDH private JWK not found in session"));

            JarmVerificationResult jarmResult = jarmVerifier.verify(jarmOption, privateJwk, walletResponse.response());
            if (jarmResult instanceof JarmVerificationResult.Failure failure) {
                logger.warn("JARM verification failed for presentationId={}: {}", presentationId.value(), failure.reason());
            }

            // id_token only and other credential formats are not supported yet
            String vpToken = jarmResult.asAuthorizationResponse()
                    .map(AuthorizationResponse::vpToken)
                    .filter(StringUtils::hasText)
                    .orElseThrow(() -> new GetWalletResponseServiceException(ErrorType.MISSING_VP_TOKEN,
                            "VP token is required for MDOC verification but was not found in the wallet response"));

            MdocVerifyResult mdocResult;
            try {
                mdocResult = mdocVerifier.verify(vpToken);
            } catch (RuntimeException e) {
                throw new GetWalletResponseServiceException(ErrorType.INVALID_RESPONSE,
                        "MDOC verification failed due to technical error", e);
            }
            logger.info("Wallet response verified: presentationId={}, valid={}, documents={}",
                    presentationId.value(), mdocResult.valid(), mdocResult.documents().size());

            if (appConfig.getTransaction().isClearSessionOnCompletion()) {
                clearTransaction(session, presentationId);
            }

            return new VerificationResult(mdocResult.valid(), mdocResult.documents(), vpToken);

        } catch (RuntimeException e) {
            GetWalletResponseServiceException error = GetWalletResponseServiceException.wrap(e,
                    ErrorType.API_REQUEST_FAILED, "Unexpected error during wallet response retrieval");
            logger.warn("GetWalletResponse failed: {}", error.getMessage());
            throw error;
        }
    }

    private PresentationId loadPresentationId(TransactionSession session) {
        Optional<PresentationId> presentationId = read(session, SessionKey.PRESENTATION_ID);
        if (presentationId.isPresent()) {
            logger.debug("Presentation ID retrieved from session");
            return presentationId.get();
        }

        logger.error("Presentation ID not found in session, present keys: {}", sessionKeysForLog(session));
        throw new GetWalletResponseServiceException(ErrorType.MISSING_PRESENTATION_ID,
                "Presentation ID not found in session. The session may have expired or the transaction "
                        + "was not properly initialized.");
    }

    private static String sessionKeysForLog(TransactionSession session) {
        try {
            return session.keys().toString();
        } catch (RuntimeException e) {
            logger.debug("Failed to retrieve session keys for diagnostics", e);
            return "<unavailable>";
        }
    }

    private static <T extends Serializable> Optional<T> read(TransactionSession session, SessionKey<T> key) {
        try {
            return session.get(key);
        } catch (RuntimeException e) {
            throw new GetWalletResponseServiceException(ErrorType.SESSION_ERROR,
                    "Failed to read '" + key + "' from session", e);
        }
    }

    /**
     * Runs once a verification outcome exists, valid or not. The outcome is returned even if the
     * slots cannot be removed; they then expire with the session.
     */
    private static void clearTransaction(TransactionSession session, PresentationId presentationId) {
        try {
            session.deleteBatch(SessionKey.PRESENTATION_ID, SessionKey.NONCE, SessionKey.EPHEMERAL_ECDH_PRIVATE_JWK);
        } catch (RuntimeException e) {
            logger.warn("Failed to clear transaction data from session for presentationId={}",
                    presentationId.value(), e);
        }
    }

}
