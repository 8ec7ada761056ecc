package io.github.drompincen.toolguard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.toolguard.protocol.api.ToolRiskProfile;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointMetadata;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointResult;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointService;
import io.github.drompincen.toolguard.runtime.tools.*;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Set;

/** Lets the agent undo its own changes by restoring a checkpoint. */
public class RestoreCheckpointTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final DateTimeFormatter CREATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int MAX_LISTED_FILES = 10;

    private CheckpointService checkpointService;

    public void setCheckpointService(CheckpointService checkpointService) {
        this.checkpointService = checkpointService;
    }

    @Override public String name() { return "restore_checkpoint"; }

    @Override public String description() {
        return "Restore project files to a previous checkpoint state. "
                + "Use this to undo changes made by previous tool executions.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("checkpoint_id").put("type", "string").put("description", "The ID of the checkpoint to restore");
        schema.putArray("required").add("checkpoint_id");
        return schema;
    }

    @Override public JsonNode outputSchema() { return MAPPER.createObjectNode().put("type", "string"); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.WRITE_FILES); }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (checkpointService == null) {
            return ToolResult.failure("Checkpointing is not available");
        }
        String checkpointId = input.hasNonNull("checkpoint_id") ? input.get("checkpoint_id").asText().trim() : "";
        if (checkpointId.isEmpty()) {
            return ToolResult.failure("checkpoint_id parameter is required");
        }

        CheckpointResult<CheckpointMetadata> found = checkpointService.getCheckpoint(checkpointId);
        if (!found.success()) {
            return ToolResult.failure(found.errorMessage() != null ? found.errorMessage() : "Checkpoint not found");
        }
        CheckpointResult<Void> restored = checkpointService.restoreCheckpoint(checkpointId);
        if (!restored.success()) {
            return ToolResult.failure(restored.errorMessage() != null ? restored.errorMessage() : "Failed to restore checkpoint");
        }

        CheckpointMetadata metadata = found.data();
        StringBuilder response = new StringBuilder();
        response.append("Successfully restored checkpoint '").append(checkpointId).append("'\n");
        response.append("Tool: ").append(metadata.toolName()).append('\n');
        response.append("Description: ").append(metadata.description()).append('\n');
        if (metadata.createdAt() != null) {
            response.append("Created: ").append(CREATED.format(metadata.createdAt().atZone(ZoneId.systemDefault()))).append('\n');
        }
        List<String> files = metadata.modifiedFiles();
        if (!files.isEmpty()) {
            response.append("Files restored: ").append(files.size()).append("\n\nRestored files:\n");
            files.stream().limit(MAX_LISTED_FILES).forEach(f -> response.append("  - ").append(f).append('\n'));
            if (files.size() > MAX_LISTED_FILES) {
                response.append("  ... and ").append(files.size() - MAX_LISTED_FILES).append(" more\n");
            }
        }
        return ToolResult.success(MAPPER.valueToTree(response.toString().trim()));
    }
}
