package io.github.drompincen.toolguard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.toolguard.protocol.api.ToolRiskProfile;
import io.github.drompincen.toolguard.runtime.tools.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

public class ListDirectoryTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "list_directory"; }
    @Override public String description() { return "List files and directories in a path"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("path").put("type", "string").put("description", "Directory to list (default: workspace root)");
        return schema;
    }

    @Override public JsonNode outputSchema() { return MAPPER.createObjectNode().put("type", "array"); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        Path resolved = ctx.resolve(input.hasNonNull("path") ? input.get("path").asText() : ".");
        try (Stream<Path> children = Files.list(resolved)) {
            List<String> entries = children
                    .map(p -> p.getFileName().toString() + (Files.isDirectory(p) ? "/" : ""))
                    .sorted()
                    .toList();
            return ToolResult.success(MAPPER.valueToTree(entries));
        } catch (IOException e) {
            return ToolResult.failure("Failed to list directory: " + e.getMessage());
        }
    }
}
