package io.github.drompincen.toolguard.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.toolguard.protocol.api.LlmToolDefinition;
import io.github.drompincen.toolguard.protocol.api.ToolDescriptor;
import io.github.drompincen.toolguard.protocol.api.ToolRiskProfile;

import java.util.Set;

/**
 * A tool the agent can call. Implementations are discovered through
 * {@code META-INF/services} and receive Spring beans through single-argument setters.
 * Tool-level problems are reported as {@link ToolResult#failure(String)}; anything thrown is
 * treated as an unexpected fault.
 */
public interface Tool {

    String name();

    String description();

    JsonNode inputSchema();

    JsonNode outputSchema();

    Set<ToolRiskProfile> riskProfiles();

    ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream);

    default ToolDescriptor descriptor() {
        return new ToolDescriptor(name(), description(), inputSchema(), outputSchema(), riskProfiles());
    }

    default LlmToolDefinition llmDefinition() {
        return new LlmToolDefinition(name(), description(), inputSchema());
    }
}
