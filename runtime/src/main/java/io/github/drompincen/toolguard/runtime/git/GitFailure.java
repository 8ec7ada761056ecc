package io.github.drompincen.toolguard.runtime.git;

public enum GitFailure {
    /** The git binary could not be located or started. */
    TOOL_UNAVAILABLE,
    /** Git ran and exited with a non-zero status. */
    COMMAND_FAILED,
    /** The calling thread was interrupted while git was running. */
    CANCELLED
}
