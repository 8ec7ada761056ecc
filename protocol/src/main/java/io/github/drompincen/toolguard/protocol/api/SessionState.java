package io.github.drompincen.toolguard.protocol.api;

public enum SessionState {
    NOT_STARTED,
    ACTIVE,
    COMMITTING,
    TIMED_OUT,
    FAILED,
    ENDED;

    /** Active and committing sessions still own a worktree and a branch. */
    public boolean isLive() {
        return this == ACTIVE || this == COMMITTING;
    }

    public boolean isTerminal() {
        return this == TIMED_OUT || this == FAILED || this == ENDED;
    }
}
