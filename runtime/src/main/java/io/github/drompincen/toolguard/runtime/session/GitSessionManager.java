package io.github.drompincen.toolguard.runtime.session;

import io.github.drompincen.toolguard.protocol.api.SessionEndReason;
import io.github.drompincen.toolguard.protocol.api.SessionState;
import io.github.drompincen.toolguard.runtime.git.GitCommandExecutor;
import io.github.drompincen.toolguard.runtime.git.GitResult;
import io.github.drompincen.toolguard.runtime.process.ProcessResult;
import io.github.drompincen.toolguard.runtime.workspace.WorkingDirectoryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the agent on {@code <branchPrefix>-<timestamp>-<id>} checked out in a worktree under
 * {@link GitSessionProperties#resolveWorktreeBasePath()}, so the user's checkout only changes
 * when a session is accepted. While a session is active the {@link WorkingDirectoryProvider}
 * points at the worktree.
 */
@Service
public class GitSessionManager implements GitSessionService {

    private static final Logger log = LoggerFactory.getLogger(GitSessionManager.class);
    private static final DateTimeFormatter BRANCH_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final List<String> BOT_IDENTITY =
            List.of("-c", "user.name=CodePunk", "-c", "user.email=codepunk@local", "-c", "commit.gpgsign=false");

    private final GitSessionProperties properties;
    private final GitCommandExecutor git;
    private final GitSessionStateStore stateStore;
    private final WorkingDirectoryProvider workingDirectory;
    private final Clock clock;

    private GitSession current;

    public GitSessionManager(GitSessionProperties properties, GitCommandExecutor git,
                             GitSessionStateStore stateStore, WorkingDirectoryProvider workingDirectory,
                             Clock clock) {
        this.properties = properties;
        this.git = git;
        this.stateStore = stateStore;
        this.workingDirectory = workingDirectory;
        this.clock = clock;
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }

    @Override
    public synchronized Optional<GitSession> currentSession() {
        return Optional.ofNullable(current);
    }

    @Override
    public synchronized Optional<GitSession> beginSession() {
        if (!properties.isEnabled()) {
            return Optional.empty();
        }
        switch (state()) {
            case ACTIVE, COMMITTING -> {
                if (!checkForTimeout()) {
                    return Optional.of(current);
                }
            }
            case NOT_STARTED, TIMED_OUT, FAILED, ENDED -> {
                // a new session may start
            }
        }

        Path workspace = workingDirectory.getOriginalDirectory();
        GitResult<Boolean> repository = git.isRepository(workspace);
        if (!repository.success() || !repository.value()) {
            log.info("{} is not a git repository, no session started", workspace);
            return Optional.empty();
        }
        GitResult<String> base = git.headCommit(workspace);
        if (!base.success()) {
            log.warn("Repository {} has no commits, no session started", workspace);
            return Optional.empty();
        }
        GitResult<String> originalBranch = git.currentBranch(workspace);
        if (!originalBranch.success()) {
            log.warn("Cannot start session in {}: {}", workspace, originalBranch.error());
            return Optional.empty();
        }
        GitResult<String> prefix = git.repositoryPrefix(workspace);
        if (!prefix.success()) {
            log.warn("Cannot locate {} inside its repository: {}", workspace, prefix.error());
            return Optional.empty();
        }

        Instant now = clock.instant();
        String sessionId = UUID.randomUUID().toString();
        String shortId = sessionId.substring(0, 8);
        String branchName = properties.getBranchPrefix() + "-"
                + BRANCH_TIMESTAMP.format(now.atZone(clock.getZone())) + "-" + shortId;
        Path worktree = properties.resolveWorktreeBasePath().resolve(workspace.getFileName() + "-" + shortId);
        try {
            Files.createDirectories(worktree.getParent());
        } catch (IOException e) {
            log.warn("Cannot create worktree directory {}: {}", worktree.getParent(), e.getMessage());
            return Optional.empty();
        }
        ProcessResult added = git.run(workspace, "worktree", "add", "-b", branchName, worktree.toString(), "HEAD");
        if (!added.success()) {
            log.warn("Failed to create worktree for {}: {}", branchName, added.errorOrOutput());
            return Optional.empty();
        }

        current = GitSession.started(sessionId, workspace, branchName, originalBranch.value(), base.value(), worktree, now);
        // the worktree holds the whole repository; tools keep working in the same subdirectory
        Path toolsDirectory = prefix.value().isEmpty() ? worktree : worktree.resolve(prefix.value());
        workingDirectory.setWorkingDirectory(toolsDirectory);
        persist(current);
        log.info("Started session {} on {} (worktree {})", sessionId, branchName, toolsDirectory);
        return Optional.of(current);
    }

    @Override
    public synchronized boolean commitToolCall(String toolName, String summary) {
        requireState(SessionState.ACTIVE, "commit a tool call");
        current = current.withState(SessionState.COMMITTING);
        persist(current);

        Path worktree = current.worktree();
        ProcessResult staged = git.run(worktree, "add", "-A");
        if (!staged.success()) {
            log.warn("Failed to stage changes for {}: {}", toolName, staged.errorOrOutput());
            return backToActive();
        }
        GitResult<Boolean> pending = git.hasStagedChanges(worktree);
        if (!pending.success()) {
            log.warn("Cannot inspect staged changes for {}: {}", toolName, pending.error());
            return backToActive();
        }
        if (!pending.value()) {
            backToActive();
            log.debug("Session {}: {} changed nothing", current.sessionId(), toolName);
            return true;
        }
        ProcessResult committed = commit(worktree, "AI Tool: " + toolName + " - " + summary);
        if (!committed.success()) {
            log.warn("Failed to commit {}: {}", toolName, committed.errorOrOutput());
            return backToActive();
        }
        GitResult<String> head = git.headCommit(worktree);
        if (!head.success()) {
            log.warn("Committed {} but cannot read HEAD: {}", toolName, head.error());
            return backToActive();
        }
        GitResult<List<String>> files = git.filesInCommit(worktree, head.value());

        current = current.withCommit(new ToolCallCommit(toolName, summary, head.value(), clock.instant(),
                files.success() ? files.value() : List.of()));
        persist(current);
        log.debug("Session {} committed {} as {}", current.sessionId(), toolName, head.value());
        return true;
    }

    @Override
    public synchronized void updateActivity() {
        requireState(SessionState.ACTIVE, "record activity");
        current = current.touched(clock.instant());
        persist(current);
    }

    @Override
    public synchronized void markAsFailed(String reason) {
        switch (state()) {
            case ACTIVE, COMMITTING -> {
                GitSession session = current;
                removeWorktree(session);
                if (!properties.isKeepFailedSessionBranches()) {
                    deleteBranch(session);
                }
                current = session.failed(reason, clock.instant());
                workingDirectory.clearOverride();
                persist(current);
                log.warn("Session {} failed: {}", session.sessionId(), reason);
            }
            case NOT_STARTED, TIMED_OUT, FAILED, ENDED ->
                    throw new IllegalSessionTransitionException(state(), "mark the session failed");
        }
    }

    @Override
    public synchronized boolean acceptSession(String commitMessage) {
        requireState(SessionState.ACTIVE, "accept");
        GitSession session = current;
        Path workspace = session.workspace();

        ProcessResult staged = git.run(session.worktree(), "add", "-A");
        GitResult<Boolean> pending = staged.success() ? git.hasStagedChanges(session.worktree()) : GitResult.failed(staged);
        if (!pending.success()) {
            log.error("Cannot inspect worktree of session {}: {}", session.sessionId(), pending.error());
            return false;
        }
        if (pending.value()) {
            ProcessResult committed = commit(session.worktree(), "AI Session: pending changes");
            if (!committed.success()) {
                log.error("Cannot commit pending changes of session {}: {}", session.sessionId(), committed.errorOrOutput());
                return false;
            }
        }

        GitResult<String> branch = git.currentBranch(workspace);
        if (!branch.success() || !branch.value().equals(session.originalBranch())) {
            ProcessResult checkout = git.run(workspace, "checkout", session.originalBranch());
            if (!checkout.success()) {
                log.error("Failed to check out {}: {}", session.originalBranch(), checkout.errorOrOutput());
                return false;
            }
        }
        log.info("Squash merging {} into {}", session.branchName(), session.originalBranch());
        ProcessResult merged = git.run(workspace, "merge", "--squash", session.branchName());
        if (!merged.success()) {
            log.error("Failed to squash merge {}: {}", session.branchName(), merged.errorOrOutput());
            return false;
        }
        GitResult<Boolean> mergedChanges = git.hasStagedChanges(workspace);
        if (mergedChanges.success() && mergedChanges.value()) {
            ProcessResult finished = commitMessage == null || commitMessage.isBlank()
                    ? git.run(workspace, "reset", "-q")
                    : git.run(workspace, "commit", "-q", "-m", commitMessage);
            if (!finished.success()) {
                log.error("Failed to finish accepting session {}: {}", session.sessionId(), finished.errorOrOutput());
                return false;
            }
        } else if (!mergedChanges.success()) {
            log.warn("Cannot check merged changes: {}", mergedChanges.error());
        }

        removeWorktree(session);
        deleteBranch(session);
        current = session.ended(SessionEndReason.ACCEPTED, clock.instant());
        workingDirectory.clearOverride();
        persist(current);
        log.info("Accepted session {} ({} tool commits)", session.sessionId(), session.commits().size());
        return true;
    }

    @Override
    public synchronized boolean discardSession() {
        return switch (state()) {
            case ACTIVE, COMMITTING, TIMED_OUT, FAILED -> {
                GitSession session = current;
                removeWorktree(session);
                deleteBranch(session);
                current = session.ended(SessionEndReason.DISCARDED, clock.instant());
                workingDirectory.clearOverride();
                persist(current);
                log.info("Discarded session {}", session.sessionId());
                yield true;
            }
            case NOT_STARTED, ENDED -> throw new IllegalSessionTransitionException(state(), "discard");
        };
    }

    @Override
    public synchronized boolean checkForTimeout() {
        if (state() != SessionState.ACTIVE) {
            return false;
        }
        GitSession session = current;
        Instant now = clock.instant();
        if (!isIdle(session, now)) {
            return false;
        }
        if (properties.isAutoRevertOnTimeout()) {
            removeWorktree(session);
            if (!properties.isKeepFailedSessionBranches()) {
                deleteBranch(session);
            }
        }
        current = session.timedOut(now);
        workingDirectory.clearOverride();
        persist(current);
        log.info("Session {} timed out after {} minutes without activity", session.sessionId(),
                properties.getSessionTimeoutMinutes());
        return true;
    }

    @Override
    public synchronized int recoverOrphanedSessions() {
        Path workspace = workingDirectory.getOriginalDirectory();
        Optional<GitSession> stored = stateStore.load(workspace);
        if (stored.isEmpty() || !stored.get().state().isLive()) {
            return 0;
        }
        GitSession orphan = stored.get();
        if (current != null && current.sessionId().equals(orphan.sessionId())) {
            return 0;
        }
        log.warn("Cleaning up orphaned session {} (branch {}, state {})",
                orphan.sessionId(), orphan.branchName(), orphan.state());
        removeWorktree(orphan);
        if (!properties.isKeepFailedSessionBranches()) {
            deleteBranch(orphan);
        }
        Instant now = clock.instant();
        GitSession resolved = isIdle(orphan, now) ? orphan.timedOut(now) : orphan.ended(SessionEndReason.ORPHANED, now);
        persist(resolved);
        return 1;
    }

    private SessionState state() {
        return current == null ? SessionState.NOT_STARTED : current.state();
    }

    private void requireState(SessionState expected, String operation) {
        if (state() != expected) {
            throw new IllegalSessionTransitionException(state(), operation);
        }
    }

    private boolean isIdle(GitSession session, Instant now) {
        Instant last = session.lastActivityAt() != null ? session.lastActivityAt() : session.startedAt();
        return Duration.between(last, now).compareTo(Duration.ofMinutes(properties.getSessionTimeoutMinutes())) > 0;
    }

    private boolean backToActive() {
        current = current.withState(SessionState.ACTIVE).touched(clock.instant());
        persist(current);
        return false;
    }

    private ProcessResult commit(Path worktree, String message) {
        List<String> args = new ArrayList<>(BOT_IDENTITY);
        args.addAll(List.of("commit", "-q", "--no-verify", "-m", message));
        return git.run(worktree, args);
    }

    private void removeWorktree(GitSession session) {
        Path workspace = session.workspace();
        Path worktree = session.worktree();
        if (Files.exists(worktree)) {
            ProcessResult removed = git.run(workspace, "worktree", "remove", "--force", worktree.toString());
            if (!removed.success()) {
                log.warn("git worktree remove failed for {}: {}", worktree, removed.errorOrOutput());
            }
        }
        if (Files.exists(worktree)) {
            try {
                FileSystemUtils.deleteRecursively(worktree);
            } catch (IOException e) {
                log.error("Failed to delete worktree directory {}", worktree, e);
            }
        }
        ProcessResult pruned = git.run(workspace, "worktree", "prune");
        if (!pruned.success()) {
            log.warn("git worktree prune failed: {}", pruned.errorOrOutput());
        }
    }

    private void deleteBranch(GitSession session) {
        Path workspace = session.workspace();
        ProcessResult exists = git.run(workspace, "rev-parse", "--verify", "--quiet", "refs/heads/" + session.branchName());
        if (!exists.success()) {
            return;
        }
        ProcessResult deleted = git.run(workspace, "branch", "-D", session.branchName());
        if (!deleted.success()) {
            log.warn("Failed to delete branch {}: {}", session.branchName(), deleted.errorOrOutput());
        }
    }

    private void persist(GitSession session) {
        try {
            stateStore.save(session);
        } catch (IOException e) {
            log.error("Failed to persist state of session {}", session.sessionId(), e);
        }
    }
}
