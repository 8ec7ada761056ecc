package io.github.drompincen.toolguard.runtime.checkpoint;

import io.github.drompincen.toolguard.runtime.git.GitResult;
import io.github.drompincen.toolguard.runtime.process.ProcessResult;

/**
 * Outcome of a checkpoint operation. Failures carry a stable {@code errorMessage} and, where
 * available, the low-level {@code errorDetails} such as git's stderr.
 */
public record CheckpointResult<T>(
        boolean success,
        T data,
        CheckpointError error,
        String errorMessage,
        String errorDetails
) {
    public static <T> CheckpointResult<T> ok(T data) {
        return new CheckpointResult<>(true, data, null, null, null);
    }

    public static CheckpointResult<Void> ok() {
        return new CheckpointResult<>(true, null, null, null, null);
    }

    public static <T> CheckpointResult<T> failed(CheckpointError error, String message) {
        return new CheckpointResult<>(false, null, error, message, null);
    }

    public static <T> CheckpointResult<T> failed(CheckpointError error, String message, String details) {
        return new CheckpointResult<>(false, null, error, message, details);
    }

    static <T> CheckpointResult<T> failed(String message, ProcessResult result) {
        CheckpointError error = switch (result.kind()) {
            case START_FAILED -> CheckpointError.TOOL_UNAVAILABLE;
            case CANCELLED -> CheckpointError.CANCELLED;
            case COMPLETED -> CheckpointError.COMMAND_FAILED;
        };
        return failed(error, message, result.errorOrOutput());
    }

    static <T> CheckpointResult<T> failed(String message, GitResult<?> result) {
        CheckpointError error = switch (result.failure()) {
            case TOOL_UNAVAILABLE -> CheckpointError.TOOL_UNAVAILABLE;
            case CANCELLED -> CheckpointError.CANCELLED;
            case COMMAND_FAILED -> CheckpointError.COMMAND_FAILED;
        };
        return failed(error, message, result.error());
    }

    /** Re-types a failure so it can be returned from an operation with a different payload. */
    public <U> CheckpointResult<U> asFailure() {
        if (success) {
            throw new IllegalStateException("Not a failure");
        }
        return new CheckpointResult<>(false, null, error, errorMessage, errorDetails);
    }
}
