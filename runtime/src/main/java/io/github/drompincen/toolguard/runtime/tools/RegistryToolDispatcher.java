package io.github.drompincen.toolguard.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.drompincen.toolguard.protocol.api.LlmToolDefinition;
import io.github.drompincen.toolguard.runtime.workspace.WorkingDirectoryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Runs tools from the {@link ToolRegistry} in the current working directory. */
@Component
public class RegistryToolDispatcher implements ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RegistryToolDispatcher.class);

    private final ToolRegistry registry;
    private final WorkingDirectoryProvider workingDirectory;

    public RegistryToolDispatcher(ToolRegistry registry, WorkingDirectoryProvider workingDirectory) {
        this.registry = registry;
        this.workingDirectory = workingDirectory;
    }

    @Override
    public List<Tool> getTools() {
        return registry.all();
    }

    @Override
    public Optional<Tool> getTool(String name) {
        return registry.get(name);
    }

    @Override
    public List<LlmToolDefinition> getLlmTools() {
        return registry.llmDefinitions();
    }

    @Override
    public ToolResult execute(String toolName, JsonNode arguments, ToolStream stream) {
        Optional<Tool> tool = registry.get(toolName);
        if (tool.isEmpty()) {
            log.warn("Unknown tool requested: {}", toolName);
            return ToolResult.failure("Unknown tool: " + toolName);
        }
        JsonNode input = arguments != null ? arguments : JsonNodeFactory.instance.objectNode();
        ToolContext ctx = new ToolContext(UUID.randomUUID().toString(), workingDirectory.getWorkingDirectory(), Map.of());
        log.debug("Executing {} in {}", toolName, ctx.workingDirectory());
        return tool.get().execute(ctx, input, stream);
    }
}
