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

/** Replaces exactly one occurrence of {@code old_text}; zero or several matches are errors. */
public class ReplaceInFileTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "replace_in_file"; }
    @Override public String description() { return "Replace a unique snippet of text in an existing file"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("file_path").put("type", "string").put("description", "File to edit");
        props.putObject("old_text").put("type", "string").put("description", "Exact text to replace; must occur once");
        props.putObject("new_text").put("type", "string").put("description", "Replacement text");
        schema.putArray("required").add("file_path").add("old_text").add("new_text");
        return schema;
    }

    @Override public JsonNode outputSchema() { return MAPPER.createObjectNode().put("type", "string"); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.WRITE_FILES); }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (!input.hasNonNull("file_path") || !input.hasNonNull("old_text") || !input.has("new_text")) {
            return ToolResult.failure("Missing required parameters: file_path, old_text, new_text");
        }
        String filePath = input.get("file_path").asText();
        String oldText = input.get("old_text").asText();
        String newText = input.get("new_text").asText();
        if (oldText.isEmpty()) {
            return ToolResult.failure("old_text must not be empty");
        }
        Path resolved = ctx.resolve(filePath);
        try {
            String content = Files.readString(resolved);
            int first = content.indexOf(oldText);
            if (first < 0) {
                return ToolResult.failure("Text not found in " + filePath);
            }
            if (content.indexOf(oldText, first + 1) >= 0) {
                return ToolResult.failure("Text occurs more than once in " + filePath + "; include more context");
            }
            Files.writeString(resolved, content.substring(0, first) + newText + content.substring(first + oldText.length()));
            return ToolResult.success(MAPPER.valueToTree("Edited " + filePath));
        } catch (IOException e) {
            return ToolResult.failure("Failed to edit file: " + e.getMessage());
        }
    }
}
