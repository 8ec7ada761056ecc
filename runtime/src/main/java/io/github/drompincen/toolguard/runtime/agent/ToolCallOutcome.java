package io.github.drompincen.toolguard.runtime.agent;

import io.github.drompincen.toolguard.protocol.api.ToolInvocationResponse;
import io.github.drompincen.toolguard.runtime.tools.ToolResult;

import java.util.List;

/**
 * Result of one tool call plus what the safety nets did around it. {@code diagnostics} never
 * replace the tool's own result.
 */
public record ToolCallOutcome(
        ToolResult result,
        String checkpointId,
        List<String> diagnostics
) {
    public ToolInvocationResponse toResponse() {
        return new ToolInvocationResponse(result.success(), result.output(), result.error(),
                result.userCancelled(), checkpointId, diagnostics);
    }
}
