package io.github.drompincen.toolguard.runtime.tools;

import java.nio.file.Path;
import java.util.Map;

/**
 * Per-call context. {@code workingDirectory} is the session worktree while a git session is
 * active, otherwise the user's workspace.
 */
public record ToolContext(
        String toolCallId,
        Path workingDirectory,
        Map<String, String> environment
) {
    public Path resolve(String path) {
        Path p = Path.of(path);
        return p.isAbsolute() ? p.normalize() : workingDirectory.resolve(p).normalize();
    }
}
