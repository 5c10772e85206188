package com.example.verifierfrontend.config;

import com.example.verifierfrontend.model.JarmOption;
import com.example.verifierfrontend.service.adapter.ResourcePresentationDefinitionGenerator;
import com.example.verifierfrontend.service.port.PresentationDefinitionGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class VerifierFrontendConfig {

    private static final Logger logger = LoggerFactory.getLogger(VerifierFrontendConfig.class);

    @Bean
    public JarmOption jarmOption(AppConfig appConfig) {
        JarmOption jarmOption = JarmOption.parse(
                        appConfig.getAuthorizationSignedResponseAlg(),
                        appConfig.getAuthorizationEncryptedResponseAlg(),
                        appConfig.getAuthorizationEncryptedResponseEnc())
                .orElseThrow(() -> new IllegalStateException(
                        "No JARM option configured: set app.authorization-signed-response-alg and/or "
                                + "app.authorization-encrypted-response-alg/-enc"));
        logger.info("JARM option: jws={}, jwe={}, enc={}",
                jarmOption.jwsAlg().orElse("-"), jarmOption.jweAlg().orElse("-"), jarmOption.jweEnc().orElse("-"));
        return jarmOption;
    }

    @Bean
    public RestClient verifierApiRestClient(RestClient.Builder restClientBuilder, AppConfig appConfig) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) appConfig.getHttp().getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) appConfig.getHttp().getReadTimeout().toMillis());
        return restClientBuilder.requestFactory(requestFactory).build();
    }

    @Bean
    public PresentationDefinitionGenerator presentationDefinitionGenerator(AppConfig appConfig, ObjectMapper objectMapper) {
        return new ResourcePresentationDefinitionGenerator(appConfig.getPresentationDefinition(), objectMapper);
    }

}
