package io.github.drompincen.toolguard.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointProperties;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointResult;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointService;
import io.github.drompincen.toolguard.runtime.tools.ToolCallClassifier;
import io.github.drompincen.toolguard.runtime.tools.ToolDispatcher;
import io.github.drompincen.toolguard.runtime.tools.ToolResult;
import io.github.drompincen.toolguard.runtime.tools.ToolStream;
import io.github.drompincen.toolguard.runtime.workspace.WorkingDirectoryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One tool call as the agent loop sees it: a checkpoint of the user's workspace before every
 * mutating call, then dispatch through the (session-aware) dispatcher.
 */
@Service
public class ToolCallPipeline {

    private static final Logger log = LoggerFactory.getLogger(ToolCallPipeline.class);

    private final ToolDispatcher dispatcher;
    private final CheckpointService checkpoints;
    private final CheckpointProperties checkpointProperties;
    private final WorkingDirectoryProvider workingDirectory;

    public ToolCallPipeline(ToolDispatcher dispatcher, CheckpointService checkpoints,
                            CheckpointProperties checkpointProperties, WorkingDirectoryProvider workingDirectory) {
        this.dispatcher = dispatcher;
        this.checkpoints = checkpoints;
        this.checkpointProperties = checkpointProperties;
        this.workingDirectory = workingDirectory;
    }

    public ToolCallOutcome execute(String toolCallId, String toolName, JsonNode arguments) {
        return execute(toolCallId, toolName, arguments, ToolStream.noop());
    }

    public ToolCallOutcome execute(String toolCallId, String toolName, JsonNode arguments, ToolStream stream) {
        String callId = toolCallId == null || toolCallId.isBlank() ? UUID.randomUUID().toString() : toolCallId;
        List<String> diagnostics = new ArrayList<>();
        String checkpointId = null;

        if (checkpointProperties.isEnabled() && !ToolCallClassifier.isReadOnly(toolName)) {
            CheckpointResult<String> checkpoint = createCheckpoint(callId, toolName, arguments);
            if (checkpoint.success()) {
                checkpointId = checkpoint.data();
            } else {
                log.warn("No checkpoint before {} ({}): {} {}", toolName, callId,
                        checkpoint.errorMessage(), checkpoint.errorDetails() != null ? checkpoint.errorDetails() : "");
                diagnostics.add("Checkpoint failed (" + checkpoint.error() + "): " + checkpoint.errorMessage());
            }
        }

        ToolResult result = dispatcher.execute(toolName, arguments, stream);
        return new ToolCallOutcome(result, checkpointId, List.copyOf(diagnostics));
    }

    /** Initializes the store on first use so an unusable workspace only degrades checkpointing. */
    public CheckpointResult<String> ensureCheckpointsInitialized() {
        if (checkpoints.isInitialized()) {
            return CheckpointResult.ok(null);
        }
        return checkpoints.initialize(workingDirectory.getOriginalDirectory());
    }

    private CheckpointResult<String> createCheckpoint(String callId, String toolName, JsonNode arguments) {
        CheckpointResult<String> init = ensureCheckpointsInitialized();
        if (!init.success()) {
            return init;
        }
        return checkpoints.createCheckpoint(callId, toolName, ToolCallClassifier.summarize(toolName, arguments));
    }
}
