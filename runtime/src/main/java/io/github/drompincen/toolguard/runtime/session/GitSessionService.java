package io.github.drompincen.toolguard.runtime.session;

import java.util.Optional;

/**
 * Lifecycle of the isolation branch the agent works on. Operations that are illegal in the
 * current state throw {@link IllegalSessionTransitionException}; git failures are logged and
 * reported through the return value.
 */
public interface GitSessionService {

    boolean isEnabled();

    /** The current or most recent session of this process, whatever its state. */
    Optional<GitSession> currentSession();

    /**
     * Starts a session, or returns the active one unchanged. Empty when sessions are disabled or
     * the workspace is not a repository with a checked-out branch.
     */
    Optional<GitSession> beginSession();

    /** Commits every worktree change; {@code true} also when there was nothing to commit, {@code false} only when git failed. */
    boolean commitToolCall(String toolName, String summary);

    void updateActivity();

    void markAsFailed(String reason);

    /**
     * Squash-merges the session branch into the original branch. A blank message leaves the
     * merged changes unstaged in the user's checkout.
     */
    boolean acceptSession(String commitMessage);

    boolean discardSession();

    /** Times out the active session if it has been idle too long; {@code true} if it did. */
    boolean checkForTimeout();

    /** Resolves a live session left behind by a previous process; returns how many were resolved. */
    int recoverOrphanedSessions();
}
