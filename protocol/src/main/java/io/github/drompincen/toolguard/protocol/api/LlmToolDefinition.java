package io.github.drompincen.toolguard.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Function definition handed to the model provider: name, description and JSON schema of the
 * parameters.
 */
public record LlmToolDefinition(
        String name,
        String description,
        JsonNode parameters
) {}
