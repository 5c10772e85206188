package com.example.verifierfrontend.service.port;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Supplies the presentation definition (DIF Presentation Exchange) sent with every init request.
 */
@FunctionalInterface
public interface PresentationDefinitionGenerator {

    JsonNode generate();

}
