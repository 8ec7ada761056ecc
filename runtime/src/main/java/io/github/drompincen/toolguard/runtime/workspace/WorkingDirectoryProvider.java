package io.github.drompincen.toolguard.runtime.workspace;

import java.nio.file.Path;

/**
 * Directory that tools operate in. A git session points it at its worktree while active and
 * clears the override when it ends.
 */
public interface WorkingDirectoryProvider {

    /** The override if one is set, otherwise the original directory. */
    Path getWorkingDirectory();

    void setWorkingDirectory(Path path);

    void clearOverride();

    /** The user's real workspace, never overridden. */
    Path getOriginalDirectory();
}
