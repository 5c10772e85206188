package com.example.verifierfrontend.service;

import com.example.verifierfrontend.config.AppConfig;
import com.example.verifierfrontend.exception.InitTransactionServiceException;
import com.example.verifierfrontend.exception.InitTransactionServiceException.ErrorType;
import com.example.verifierfrontend.model.EphemeralEcdhPrivateJwk;
import com.example.verifierfrontend.model.EphemeralEcdhPublicJwk;
import com.example.verifierfrontend.model.InitTransactionRequest;
import com.example.verifierfrontend.model.InitTransactionResponse;
import com.example.verifierfrontend.model.InitTransactionResult;
import com.example.verifierfrontend.model.Nonce;
import com.example.verifierfrontend.model.PresentationId;
import com.example.verifierfrontend.service.port.EphemeralKeyGenerator;
import com.example.verifierfrontend.service.port.MobileDeviceDetector;
import com.example.verifierfrontend.service.port.NonceGenerator;
import com.example.verifierfrontend.service.port.PresentationDefinitionGenerator;
import com.example.verifierfrontend.service.port.VerifierApiClient;
import com.example.verifierfrontend.service.port.WalletRedirectUriGenerator;
import com.example.verifierfrontend.service.port.WalletResponseRedirectUriTemplateGenerator;
import com.example.verifierfrontend.session.SessionKey;
import com.example.verifierfrontend.session.TransactionSession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Phase one of the presentation flow. Opens a transaction at the verifier backend, keeps the
 * transaction secrets in the user's session and tells the caller where to send the user.
 *
 * <ol>
 *   <li>Require a User-Agent and classify the device</li>
 *   <li>Generate nonce and ephemeral ECDH key; only the public JWK is sent</li>
 *   <li>POST the init request (redirect URI template only for mobile)</li>
 *   <li>Store presentation id, nonce and private JWK in the session</li>
 *   <li>Build the wallet redirect URI from the backend's client_id / request / request_uri</li>
 * </ol>
 */
@Service
public class InitTransactionService {

    private static final Logger logger = LoggerFactory.getLogger(InitTransactionService.class);

    private final AppConfig appConfig;
    private final NonceGenerator nonceGenerator;
    private final EphemeralKeyGenerator ephemeralKeyGenerator;
    private final PresentationDefinitionGenerator presentationDefinitionGenerator;
    private final WalletResponseRedirectUriTemplateGenerator redirectUriTemplateGenerator;
    private final WalletRedirectUriGenerator walletRedirectUriGenerator;
    private final MobileDeviceDetector mobileDeviceDetector;
    private final VerifierApiClient verifierApiClient;
    private final ObjectMapper objectMapper;

    public InitTransactionService(AppConfig appConfig,
                                  NonceGenerator nonceGenerator,
                                  EphemeralKeyGenerator ephemeralKeyGenerator,
                                  PresentationDefinitionGenerator presentationDefinitionGenerator,
                                  WalletResponseRedirectUriTemplateGenerator redirectUriTemplateGenerator,
                                  WalletRedirectUriGenerator walletRedirectUriGenerator,
                                  MobileDeviceDetector mobileDeviceDetector,
                                  VerifierApiClient verifierApiClient,
                                  ObjectMapper objectMapper) {
        if (!StringUtils.hasText(appConfig.getApiBaseUrl())
                || !StringUtils.hasText(appConfig.getInitTransactionApiPath())
                || !StringUtils.hasText(appConfig.getPublicUrl())
                || !StringUtils.hasText(appConfig.getWalletUrl())) {
            throw new InitTransactionServiceException(ErrorType.INVALID_RESPONSE,
                    "Required configuration parameters are missing");
        }
        this.appConfig = appConfig;
        this.nonceGenerator = nonceGenerator;
        this.ephemeralKeyGenerator = ephemeralKeyGenerator;
        this.presentationDefinitionGenerator = presentationDefinitionGenerator;
        this.redirectUriTemplateGenerator = redirectUriTemplateGenerator;
        this.walletRedirectUriGenerator = walletRedirectUriGenerator;
        this.mobileDeviceDetector = mobileDeviceDetector;
        this.verifierApiClient = verifierApiClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Initiates a transaction for the user owning {@code session}.
     *
     * @param headers inbound request headers, must carry User-Agent
     * @param session the caller's transaction session, written once on success
     * @return wallet redirect URI and whether the caller is on a mobile device
     * @throws InitTransactionServiceException for every failure, classified by {@link ErrorType}
     */
    public InitTransactionResult initTransaction(HttpHeaders headers, TransactionSession session) {
        try {
            String userAgent = requireUserAgent(headers);
            boolean mobile = mobileDeviceDetector.isMobile(userAgent);

            Nonce nonce = nonceGenerator.generate();
            EphemeralEcdhPrivateJwk privateJwk = ephemeralKeyGenerator.generate();
            EphemeralEcdhPublicJwk publicJwk = privateJwk.derivePublic();

            InitTransactionRequest request = generateRequest(mobile, nonce, publicJwk);
            logger.debug("Sending InitTransaction request: type={}, mobile={}", request.type().value(), mobile);

            JsonNode data;
            try {
                data = verifierApiClient.post(appConfig.getApiBaseUrl(), appConfig.getInitTransactionApiPath(), request);
            } catch (RuntimeException e) {
                throw new InitTransactionServiceException(ErrorType.API_REQUEST_FAILED,
                        "Failed to communicate with InitTransaction API", e);
            }

            InitTransactionResponse response;
            try {
                response = InitTransactionResponse.fromJson(data, objectMapper);
            } catch (Exception e) {
                throw new InitTransactionServiceException(ErrorType.INVALID_RESPONSE,
                        "Failed to parse InitTransaction API response", e);
            }

            PresentationId presentationId = response.toPresentationId();
            storeTransaction(session, presentationId, nonce, privateJwk);

            String walletRedirectUri;
            try {
                walletRedirectUri = walletRedirectUriGenerator.generate(appConfig.getWalletUrl(), response.toWalletRedirectParams());
            } catch (RuntimeException e) {
                throw new InitTransactionServiceException(ErrorType.INVALID_RESPONSE,
                        "Failed to generate wallet redirect URI", e);
            }

            logger.info("Transaction initiated: presentationId={}, mobile={}", presentationId.value(), mobile);
            return new InitTransactionResult(walletRedirectUri, mobile);

        } catch (RuntimeException e) {
            InitTransactionServiceException error = InitTransactionServiceException.wrap(e,
                    ErrorType.API_REQUEST_FAILED, "Unexpected error during transaction initialization");
            logger.warn("InitTransaction failed: {}", error.getMessage());
            throw error;
        }
    }

    InitTransactionRequest generateRequest(boolean mobile, Nonce nonce, EphemeralEcdhPublicJwk publicJwk) {
        String publicUrl = appConfig.getPublicUrl();
        String redirectPath = appConfig.getWalletResponseRedirectPath();
        String placeholder = appConfig.getWalletResponseRedirectQueryTemplate();
        if (!StringUtils.hasText(publicUrl) || !StringUtils.hasText(redirectPath) || !StringUtils.hasText(placeholder)) {
            throw new InitTransactionServiceException(ErrorType.INVALID_RESPONSE, "Required URL parameters are missing");
        }

        String redirectUriTemplate = mobile
                ? redirectUriTemplateGenerator.generate(publicUrl, redirectPath, placeholder)
                : null;

        return new InitTransactionRequest(
                appConfig.getTokenType(),
                presentationDefinitionGenerator.generate(),
                nonce.value(),
                appConfig.getResponseMode(),
                appConfig.getJarMode(),
                appConfig.getPresentationDefinitionMode(),
                publicJwk.value(),
                redirectUriTemplate
        );
    }

    private static String requireUserAgent(HttpHeaders headers) {
        String userAgent = headers != null ? headers.getFirst(HttpHeaders.USER_AGENT) : null;
        if (!StringUtils.hasText(userAgent)) {
            throw new InitTransactionServiceException(ErrorType.MISSING_USER_AGENT,
                    "User agent header is required to determine device type");
        }
        return userAgent;
    }

    /**
     * Writes the three slots in order. If one write fails the slots written so far are removed again,
     * so the session never holds a partial transaction.
     */
    private static void storeTransaction(TransactionSession session, PresentationId presentationId,
                                         Nonce nonce, EphemeralEcdhPrivateJwk privateJwk) {
        try {
            session.set(SessionKey.PRESENTATION_ID, presentationId);
            session.set(SessionKey.NONCE, nonce);
            session.set(SessionKey.EPHEMERAL_ECDH_PRIVATE_JWK, privateJwk);
        } catch (RuntimeException e) {
            InitTransactionServiceException error = new InitTransactionServiceException(ErrorType.SESSION_ERROR,
                    "Failed to store transaction data in session", e);
            try {
                session.deleteBatch(SessionKey.PRESENTATION_ID, SessionKey.NONCE, SessionKey.EPHEMERAL_ECDH_PRIVATE_JWK);
            } catch (RuntimeException rollbackError) {
                error.addSuppressed(rollbackError);
            }
            throw error;
        }
    }

}
