package io.github.drompincen.toolguard.protocol.api;

public enum ToolRiskProfile {
    READ_ONLY,
    WRITE_FILES,
    EXEC_SHELL,
    NETWORK_CALLS
}
