package io.github.drompincen.toolguard.runtime.git;

import io.github.drompincen.toolguard.runtime.process.ProcessResult;

public record GitResult<T>(
        boolean success,
        T value,
        String error,
        int exitCode,
        GitFailure failure
) {
    public static <T> GitResult<T> ok(T value) {
        return new GitResult<>(true, value, "", 0, null);
    }

    public static <T> GitResult<T> failed(String error, int exitCode, GitFailure failure) {
        return new GitResult<>(false, null, error, exitCode, failure);
    }

    public static <T> GitResult<T> failed(ProcessResult result) {
        GitFailure failure = switch (result.kind()) {
            case START_FAILED -> GitFailure.TOOL_UNAVAILABLE;
            case CANCELLED -> GitFailure.CANCELLED;
            case COMPLETED -> GitFailure.COMMAND_FAILED;
        };
        return failed(result.errorOrOutput(), result.exitCode(), failure);
    }

    public boolean isCancelled() {
        return failure == GitFailure.CANCELLED;
    }
}
