package io.github.drompincen.toolguard.runtime.process;

public record ProcessResult(
        Kind kind,
        int exitCode,
        String output,
        String error
) {
    public static final String CANCELLED_MARKER = "cancelled";

    public enum Kind {
        COMPLETED,
        START_FAILED,
        CANCELLED
    }

    public static ProcessResult completed(int exitCode, String output, String error) {
        return new ProcessResult(Kind.COMPLETED, exitCode, output, error);
    }

    public static ProcessResult startFailed(String error) {
        return new ProcessResult(Kind.START_FAILED, -1, "", error);
    }

    public static ProcessResult cancelled() {
        return new ProcessResult(Kind.CANCELLED, -1, "", CANCELLED_MARKER);
    }

    public boolean success() {
        return kind == Kind.COMPLETED && exitCode == 0;
    }

    public boolean isCancelled() {
        return kind == Kind.CANCELLED;
    }

    /** Error text if present, otherwise whatever the process printed on stdout. */
    public String errorOrOutput() {
        return error == null || error.isBlank() ? output : error;
    }
}
