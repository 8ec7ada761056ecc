package io.github.drompincen.toolguard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.toolguard.protocol.api.ToolRiskProfile;
import io.github.drompincen.toolguard.runtime.tools.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

public class ReadFileTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "read_file"; }
    @Override public String description() { return "Read the contents of a file"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("path").put("type", "string").put("description", "File path, relative to the workspace");
        schema.putArray("required").add("path");
        return schema;
    }

    @Override public JsonNode outputSchema() { return MAPPER.createObjectNode().put("type", "string"); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (!input.hasNonNull("path")) {
            return ToolResult.failure("Missing required parameter: path");
        }
        Path resolved = ctx.resolve(input.get("path").asText());
        try {
            return ToolResult.success(MAPPER.valueToTree(Files.readString(resolved)));
        } catch (IOException e) {
            return ToolResult.failure("Failed to read file: " + e.getMessage());
        }
    }
}
