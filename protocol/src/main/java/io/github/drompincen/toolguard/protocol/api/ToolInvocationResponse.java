package io.github.drompincen.toolguard.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record ToolInvocationResponse(
        boolean success,
        JsonNode output,
        String error,
        boolean userCancelled,
        String checkpointId,
        List<String> diagnostics
) {}
