package io.github.drompincen.toolguard.runtime.session;

import io.github.drompincen.toolguard.protocol.api.GitSessionDto;
import io.github.drompincen.toolguard.protocol.api.SessionEndReason;
import io.github.drompincen.toolguard.protocol.api.SessionState;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One agent working period on an isolation branch checked out in its own worktree. Immutable;
 * every transition returns a new instance, which is also what gets persisted.
 */
public record GitSession(
        String sessionId,
        String workspacePath,
        String branchName,
        String originalBranch,
        String baseCommit,
        String worktreePath,
        SessionState state,
        Instant startedAt,
        Instant lastActivityAt,
        Instant endedAt,
        String failureReason,
        SessionEndReason endReason,
        List<ToolCallCommit> commits
) {
    public GitSession {
        commits = commits == null ? List.of() : List.copyOf(commits);
    }

    public static GitSession started(String sessionId, Path workspace, String branchName, String originalBranch,
                                     String baseCommit, Path worktree, Instant now) {
        return new GitSession(sessionId, workspace.toString(), branchName, originalBranch, baseCommit,
                worktree.toString(), SessionState.ACTIVE, now, now, null, null, null, List.of());
    }

    public Path workspace() {
        return Path.of(workspacePath);
    }

    public Path worktree() {
        return Path.of(worktreePath);
    }

    public GitSession withState(SessionState newState) {
        return new GitSession(sessionId, workspacePath, branchName, originalBranch, baseCommit, worktreePath,
                newState, startedAt, lastActivityAt, endedAt, failureReason, endReason, commits);
    }

    public GitSession touched(Instant now) {
        return new GitSession(sessionId, workspacePath, branchName, originalBranch, baseCommit, worktreePath,
                state, startedAt, now, endedAt, failureReason, endReason, commits);
    }

    public GitSession withCommit(ToolCallCommit commit) {
        List<ToolCallCommit> all = new ArrayList<>(commits);
        all.add(commit);
        return new GitSession(sessionId, workspacePath, branchName, originalBranch, baseCommit, worktreePath,
                SessionState.ACTIVE, startedAt, commit.committedAt(), endedAt, failureReason, endReason, all);
    }

    public GitSession failed(String reason, Instant now) {
        return new GitSession(sessionId, workspacePath, branchName, originalBranch, baseCommit, worktreePath,
                SessionState.FAILED, startedAt, lastActivityAt, now, reason, null, commits);
    }

    public GitSession timedOut(Instant now) {
        return new GitSession(sessionId, workspacePath, branchName, originalBranch, baseCommit, worktreePath,
                SessionState.TIMED_OUT, startedAt, lastActivityAt, now, failureReason, SessionEndReason.TIMED_OUT, commits);
    }

    public GitSession ended(SessionEndReason reason, Instant now) {
        return new GitSession(sessionId, workspacePath, branchName, originalBranch, baseCommit, worktreePath,
                SessionState.ENDED, startedAt, lastActivityAt, now, failureReason, reason, commits);
    }

    public GitSessionDto toDto() {
        return new GitSessionDto(sessionId, branchName, originalBranch, worktreePath, state,
                startedAt, lastActivityAt, endedAt, endReason, failureReason,
                commits.stream().map(ToolCallCommit::toDto).toList());
    }
}
