package io.github.drompincen.toolguard.protocol.api;

public enum SessionEndReason {
    ACCEPTED,
    DISCARDED,
    TIMED_OUT,
    ORPHANED
}
