package io.github.drompincen.toolguard.runtime.workspace;

import java.nio.file.Path;

public final class WorkspacePaths {

    private WorkspacePaths() {}

    /** Resolves a leading {@code ~/} against the user's home directory. */
    public static Path expandHome(String path) {
        if (path.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (path.startsWith("~/") || path.startsWith("~\\")) {
            return Path.of(System.getProperty("user.home"), path.substring(2));
        }
        return Path.of(path);
    }
}
