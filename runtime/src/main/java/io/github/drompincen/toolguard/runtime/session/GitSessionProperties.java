package io.github.drompincen.toolguard.runtime.session;

import io.github.drompincen.toolguard.runtime.workspace.WorkspacePaths;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "git-session")
public class GitSessionProperties {

    public static final String DEFAULT_STATE_STORE = "~/.codepunk/git-sessions";

    private boolean enabled = true;
    private boolean autoStartSession = true;
    private String branchPrefix = "ai/session";
    /** Blank means {@code <java.io.tmpdir>/codepunk-sessions}. */
    private String worktreeBasePath = "";
    private int sessionTimeoutMinutes = 30;
    private boolean autoRevertOnTimeout = true;
    private boolean cleanupOrphanedSessionsOnStartup = true;
    private boolean keepFailedSessionBranches = false;
    private String stateStorePath = DEFAULT_STATE_STORE;
    private long timeoutCheckIntervalMs = 60_000;

    public Path resolveWorktreeBasePath() {
        if (worktreeBasePath == null || worktreeBasePath.isBlank()) {
            return Path.of(System.getProperty("java.io.tmpdir"), "codepunk-sessions").toAbsolutePath().normalize();
        }
        return WorkspacePaths.expandHome(worktreeBasePath).toAbsolutePath().normalize();
    }

    public Path resolveStateStorePath() {
        String dir = stateStorePath == null || stateStorePath.isBlank() ? DEFAULT_STATE_STORE : stateStorePath;
        return WorkspacePaths.expandHome(dir).toAbsolutePath().normalize();
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public boolean isAutoStartSession() { return autoStartSession; }
    public void setAutoStartSession(boolean autoStartSession) { this.autoStartSession = autoStartSession; }

    public String getBranchPrefix() { return branchPrefix; }
    public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }

    public String getWorktreeBasePath() { return worktreeBasePath; }
    public void setWorktreeBasePath(String worktreeBasePath) { this.worktreeBasePath = worktreeBasePath; }

    public int getSessionTimeoutMinutes() { return sessionTimeoutMinutes; }
    public void setSessionTimeoutMinutes(int sessionTimeoutMinutes) { this.sessionTimeoutMinutes = sessionTimeoutMinutes; }

    public boolean isAutoRevertOnTimeout() { return autoRevertOnTimeout; }
    public void setAutoRevertOnTimeout(boolean autoRevertOnTimeout) { this.autoRevertOnTimeout = autoRevertOnTimeout; }

    public boolean isCleanupOrphanedSessionsOnStartup() { return cleanupOrphanedSessionsOnStartup; }
    public void setCleanupOrphanedSessionsOnStartup(boolean cleanup) { this.cleanupOrphanedSessionsOnStartup = cleanup; }

    public boolean isKeepFailedSessionBranches() { return keepFailedSessionBranches; }
    public void setKeepFailedSessionBranches(boolean keep) { this.keepFailedSessionBranches = keep; }

    public String getStateStorePath() { return stateStorePath; }
    public void setStateStorePath(String stateStorePath) { this.stateStorePath = stateStorePath; }

    public long getTimeoutCheckIntervalMs() { return timeoutCheckIntervalMs; }
    public void setTimeoutCheckIntervalMs(long timeoutCheckIntervalMs) { this.timeoutCheckIntervalMs = timeoutCheckIntervalMs; }
}
