package com.example.verifierfrontend.service.adapter;

import com.example.verifierfrontend.service.port.PresentationDefinitionGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.util.Assert;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Serves a presentation definition loaded once from a JSON resource.
 * Every call returns a fresh copy so callers cannot alter the shared definition.
 */
public class ResourcePresentationDefinitionGenerator implements PresentationDefinitionGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ResourcePresentationDefinitionGenerator.class);

    private final JsonNode presentationDefinition;

    public ResourcePresentationDefinitionGenerator(Resource resource, ObjectMapper objectMapper) {
        Assert.notNull(resource, "Presentation definition resource must be configured");
        try (InputStream in = resource.getInputStream()) {
            this.presentationDefinition = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read presentation definition from " + resource.getDescription(), e);
        }
        Assert.isTrue(presentationDefinition != null && presentationDefinition.isObject(),
                "Presentation definition must be a JSON object: " + resource.getDescription());
        Assert.isTrue(presentationDefinition.hasNonNull("id"), "Presentation definition must have an id");
        logger.info("Loaded presentation definition '{}' from {}",
                presentationDefinition.get("id").asText(), resource.getDescription());
    }

    @Override
    public JsonNode generate() {
        return presentationDefinition.deepCopy();
    }

}
