package io.github.drompincen.toolguard.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolResult(
        boolean success,
        JsonNode output,
        String error,
        boolean userCancelled
) {
    public static ToolResult success(JsonNode output) {
        return new ToolResult(true, output, null, false);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error, false);
    }

    public static ToolResult cancelled(String error) {
        return new ToolResult(false, null, error, true);
    }

    public boolean isError() {
        return !success;
    }

    /** Text handed back to the model: the output, or the error message. */
    public String content() {
        if (output != null) {
            return output.isTextual() ? output.asText() : output.toString();
        }
        return error != null ? error : "";
    }
}
