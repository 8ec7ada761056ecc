package io.github.drompincen.toolguard.runtime.session;

import io.github.drompincen.toolguard.runtime.workspace.JsonRecordFiles;
import io.github.drompincen.toolguard.runtime.workspace.WorkspaceIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Durable projection of the current (or last) session of each workspace, one JSON file per
 * workspace hash. Survives restarts so a crashed process's session can be cleaned up.
 */
@Component
public class GitSessionStateStore {

    private static final Logger log = LoggerFactory.getLogger(GitSessionStateStore.class);

    private final Path storeDirectory;

    public GitSessionStateStore(GitSessionProperties properties) {
        this.storeDirectory = properties.resolveStateStorePath();
    }

    public void save(GitSession session) throws IOException {
        JsonRecordFiles.write(fileFor(session.workspace()), session);
    }

    /** The stored record, or empty if there is none or it cannot be read. */
    public Optional<GitSession> load(Path workspace) {
        Path file = fileFor(workspace);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(JsonRecordFiles.read(file, GitSession.class));
        } catch (IOException e) {
            log.error("Failed to read session state {}", file, e);
            return Optional.empty();
        }
    }

    public void clear(Path workspace) throws IOException {
        Files.deleteIfExists(fileFor(workspace));
    }

    Path fileFor(Path workspace) {
        return storeDirectory.resolve(WorkspaceIdentity.of(workspace) + ".json");
    }
}
