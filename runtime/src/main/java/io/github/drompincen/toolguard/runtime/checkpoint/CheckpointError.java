package io.github.drompincen.toolguard.runtime.checkpoint;

public enum CheckpointError {
    TOOL_UNAVAILABLE,
    COMMAND_FAILED,
    NOT_INITIALIZED,
    NOT_FOUND,
    SERIALIZATION,
    CANCELLED,
    IO_FAILURE,
    DISABLED
}
