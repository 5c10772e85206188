package com.example.verifierfrontend.config;

import com.example.verifierfrontend.model.EmbedMode;
import com.example.verifierfrontend.model.PresentationType;
import com.example.verifierfrontend.model.ResponseMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "app")
public class AppConfig {

    private String apiBaseUrl;
    private String initTransactionApiPath;
    private String getWalletResponseApiPath;
    private String publicUrl;
    private String walletUrl;
    private String walletResponseRedirectPath;
    private String walletResponseRedirectQueryTemplate = "{RESPONSE_CODE}";

    private PresentationType tokenType = PresentationType.VP_TOKEN;
    private ResponseMode responseMode;
    private EmbedMode jarMode;
    private EmbedMode presentationDefinitionMode;

    /**
     * JARM settings, named after the OAuth client metadata parameters.
     */
    private String authorizationSignedResponseAlg;
    private String authorizationEncryptedResponseAlg = "ECDH-ES+A256KW";
    private String authorizationEncryptedResponseEnc = "A256GCM";

    private Resource presentationDefinition;

    private final Http http = new Http();
    private final Transaction transaction = new Transaction();

    // Getters and setters

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
        this.apiBaseUrl = apiBaseUrl;
    }

    public String getInitTransactionApiPath() {
        return initTransactionApiPath;
    }

    public void setInitTransactionApiPath(String initTransactionApiPath) {
        this.initTransactionApiPath = initTransactionApiPath;
    }

    public String getGetWalletResponseApiPath() {
        return getWalletResponseApiPath;
    }

    public void setGetWalletResponseApiPath(String getWalletResponseApiPath) {
        this.getWalletResponseApiPath = getWalletResponseApiPath;
    }

    public String getPublicUrl() {
        return publicUrl;
    }

    public void setPublicUrl(String publicUrl) {
        this.publicUrl = publicUrl;
    }

    public String getWalletUrl() {
        return walletUrl;
    }

    public void setWalletUrl(String walletUrl) {
        this.walletUrl = walletUrl;
    }

    public String getWalletResponseRedirectPath() {
        return walletResponseRedirectPath;
    }

    public void setWalletResponseRedirectPath(String walletResponseRedirectPath) {
        this.walletResponseRedirectPath = walletResponseRedirectPath;
    }

    public String getWalletResponseRedirectQueryTemplate() {
        return walletResponseRedirectQueryTemplate;
    }

    public void setWalletResponseRedirectQueryTemplate(String walletResponseRedirectQueryTemplate) {
        this.walletResponseRedirectQueryTemplate = walletResponseRedirectQueryTemplate;
    }

    public PresentationType getTokenType() {
        return tokenType;
    }

    public void setTokenType(PresentationType tokenType) {
        this.tokenType = tokenType;
    }

    public ResponseMode getResponseMode() {
        return responseMode;
    }

    public void setResponseMode(ResponseMode responseMode) {
        this.responseMode = responseMode;
    }

    public EmbedMode getJarMode() {
        return jarMode;
    }

    public void setJarMode(EmbedMode jarMode) {
        this.jarMode = jarMode;
    }

    public EmbedMode getPresentationDefinitionMode() {
        return presentationDefinitionMode;
    }

    public void setPresentationDefinitionMode(EmbedMode presentationDefinitionMode) {
        this.presentationDefinitionMode = presentationDefinitionMode;
    }

    public String getAuthorizationSignedResponseAlg() {
        return authorizationSignedResponseAlg;
    }

    public void setAuthorizationSignedResponseAlg(String authorizationSignedResponseAlg) {
        this.authorizationSignedResponseAlg = authorizationSignedResponseAlg;
    }

    public String getAuthorizationEncryptedResponseAlg() {
        return authorizationEncryptedResponseAlg;
    }

    public void setAuthorizationEncryptedResponseAlg(String authorizationEncryptedResponseAlg) {
        this.authorizationEncryptedResponseAlg = authorizationEncryptedResponseAlg;
    }

    public String getAuthorizationEncryptedResponseEnc() {
        return authorizationEncryptedResponseEnc;
    }

    public void setAuthorizationEncryptedResponseEnc(String authorizationEncryptedResponseEnc) {
        this.authorizationEncryptedResponseEnc = authorizationEncryptedResponseEnc;
    }

    public Resource getPresentationDefinition() {
        return presentationDefinition;
    }

    public void setPresentationDefinition(Resource presentationDefinition) {
        this.presentationDefinition = presentationDefinition;
    }

    public Http getHttp() {
        return http;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    /**
     * Timeouts of the client calling the verifier backend.
     */
    public static class Http {

        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class Transaction {

        /**
         * Delete presentation id, nonce and ephemeral key once the wallet response has been verified.
         */
        private boolean clearSessionOnCompletion = false;

        public boolean isClearSessionOnCompletion() {
            return clearSessionOnCompletion;
        }

        public void setClearSessionOnCompletion(boolean clearSessionOnCompletion) {
            this.clearSessionOnCompletion = clearSessionOnCompletion;
        }
    }

}
