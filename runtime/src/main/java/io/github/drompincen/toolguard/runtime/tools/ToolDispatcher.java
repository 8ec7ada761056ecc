package io.github.drompincen.toolguard.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.toolguard.protocol.api.LlmToolDefinition;

import java.util.List;
import java.util.Optional;

/**
 * The tool dispatch boundary the agent loop calls through. Decorators such as
 * {@link GitSessionToolInterceptor} must keep the result contract unchanged.
 */
public interface ToolDispatcher {

    List<Tool> getTools();

    Optional<Tool> getTool(String name);

    List<LlmToolDefinition> getLlmTools();

    ToolResult execute(String toolName, JsonNode arguments, ToolStream stream);

    default ToolResult execute(String toolName, JsonNode arguments) {
        return execute(toolName, arguments, ToolStream.noop());
    }
}
