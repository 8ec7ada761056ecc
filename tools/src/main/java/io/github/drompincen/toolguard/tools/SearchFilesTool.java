package io.github.drompincen.toolguard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.toolguard.protocol.api.ToolRiskProfile;
import io.github.drompincen.toolguard.runtime.tools.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

public class SearchFilesTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_DEPTH = 10;
    private static final int MAX_RESULTS = 100;

    @Override public String name() { return "search_files"; }
    @Override public String description() { return "Search for files matching a glob pattern"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("pattern").put("type", "string").put("description", "Glob pattern (e.g. **/*.java)");
        props.putObject("path").put("type", "string").put("description", "Base directory");
        schema.putArray("required").add("pattern");
        return schema;
    }

    @Override public JsonNode outputSchema() { return MAPPER.createObjectNode().put("type", "array"); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (!input.hasNonNull("pattern")) {
            return ToolResult.failure("Missing required parameter: pattern");
        }
        Path base = ctx.resolve(input.hasNonNull("path") ? input.get("path").asText() : ".");
        PathMatcher matcher;
        try {
            matcher = FileSystems.getDefault().getPathMatcher("glob:" + input.get("pattern").asText());
        } catch (IllegalArgumentException e) {
            return ToolResult.failure("Invalid pattern: " + e.getMessage());
        }
        try (Stream<Path> walk = Files.walk(base, MAX_DEPTH)) {
            List<String> results = walk
                    .filter(p -> !p.equals(base))
                    .map(base::relativize)
                    .filter(matcher::matches)
                    .map(p -> p.toString().replace('\\', '/'))
                    .sorted()
                    .limit(MAX_RESULTS)
                    .toList();
            return ToolResult.success(MAPPER.valueToTree(results));
        } catch (IOException | UncheckedIOException e) {
            return ToolResult.failure("Search failed: " + e.getMessage());
        }
    }
}
