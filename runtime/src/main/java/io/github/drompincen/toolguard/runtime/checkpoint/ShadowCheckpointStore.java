package io.github.drompincen.toolguard.runtime.checkpoint;

import io.github.drompincen.toolguard.runtime.git.GitCommandExecutor;
import io.github.drompincen.toolguard.runtime.git.GitResult;
import io.github.drompincen.toolguard.runtime.process.ProcessResult;
import io.github.drompincen.toolguard.runtime.workspace.JsonRecordFiles;
import io.github.drompincen.toolguard.runtime.workspace.WorkingDirectoryProvider;
import io.github.drompincen.toolguard.runtime.workspace.WorkspaceIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Checkpoints kept in a private git repository per workspace:
 * {@code <checkpointDirectory>/<workspaceHash>/mirror} holds a copy of the workspace and one
 * commit per checkpoint, {@code .../metadata/<id>.json} describes each checkpoint. The user's
 * repository, if any, is never touched.
 *
 * <p>The store is keyed by the workspace it was initialized with, but files are read from and
 * restored into the directory tools currently work in. While a git session redirects tools to
 * its worktree, checkpoints capture and restore the worktree and the user's checkout is left
 * alone.
 *
 * <p>All operations are serialized on this instance.
 */
@Service
public class ShadowCheckpointStore implements CheckpointService {

    private static final Logger log = LoggerFactory.getLogger(ShadowCheckpointStore.class);
    private static final Pattern CHECKPOINT_ID = Pattern.compile("[A-Za-z0-9-]+");
    static final String BOT_NAME = "CodePunk";
    static final String BOT_EMAIL = "codepunk@local";

    private final CheckpointProperties properties;
    private final GitCommandExecutor git;
    private final WorkingDirectoryProvider workingDirectory;
    private final Clock clock;

    private Path workspacePath;
    private Path mirrorPath;
    private Path metadataPath;
    private Predicate<Path> excluded;
    private long lastSequence;
    private boolean initialized;

    public ShadowCheckpointStore(CheckpointProperties properties, GitCommandExecutor git,
                                 WorkingDirectoryProvider workingDirectory, Clock clock) {
        this.properties = properties;
        this.git = git;
        this.workingDirectory = workingDirectory;
        this.clock = clock;
    }

    @Override
    public synchronized CheckpointResult<String> initialize(Path workspace) {
        Path root = workspace.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            return CheckpointResult.failed(CheckpointError.IO_FAILURE, "Workspace does not exist", root.toString());
        }
        String hash = WorkspaceIdentity.of(root);
        Path checkpointRoot = properties.resolveCheckpointDirectory();
        Path storeRoot = checkpointRoot.resolve(hash);
        Path mirror = storeRoot.resolve("mirror");
        Path metadata = storeRoot.resolve("metadata");
        try {
            Files.createDirectories(mirror);
            Files.createDirectories(metadata);
        } catch (IOException e) {
            log.error("Cannot create checkpoint directories under {}", storeRoot, e);
            return CheckpointResult.failed(CheckpointError.IO_FAILURE, "Failed to create checkpoint directories", e.getMessage());
        }

        if (!Files.exists(mirror.resolve(".git"))) {
            ProcessResult init = git.run(mirror, "init", "-q");
            if (!init.success()) {
                return CheckpointResult.failed("Failed to initialize shadow repository", init);
            }
            for (List<String> setting : List.of(
                    List.of("config", "user.name", BOT_NAME),
                    List.of("config", "user.email", BOT_EMAIL),
                    List.of("config", "commit.gpgsign", "false"))) {
                ProcessResult configured = git.run(mirror, setting);
                if (!configured.success()) {
                    return CheckpointResult.failed("Failed to configure shadow repository", configured);
                }
            }
            log.info("Created shadow repository {} for workspace {}", mirror, root);
        }

        Set<String> excludedNames = Set.copyOf(properties.getExcludedDirectories());
        this.excluded = dir -> excludedNames.contains(String.valueOf(dir.getFileName()))
                || dir.startsWith(checkpointRoot);
        this.workspacePath = root;
        this.mirrorPath = mirror;
        this.metadataPath = metadata;
        try {
            this.lastSequence = readAllMetadata().stream().mapToLong(CheckpointMetadata::sequence).max().orElse(0);
        } catch (IOException e) {
            return CheckpointResult.failed(CheckpointError.IO_FAILURE, "Failed to read checkpoint metadata", e.getMessage());
        }
        this.initialized = true;
        log.debug("Checkpoint store ready for {} ({})", root, hash);
        return CheckpointResult.ok(hash);
    }

    @Override
    public synchronized boolean isInitialized() {
        return initialized;
    }

    @Override
    public synchronized CheckpointResult<String> createCheckpoint(String toolCallId, String toolName, String description) {
        if (!properties.isEnabled()) {
            return CheckpointResult.failed(CheckpointError.DISABLED, "Checkpointing is disabled");
        }
        if (!initialized) {
            return notInitialized();
        }
        String id = UUID.randomUUID().toString().replace("-", "");
        Path source = liveDirectory();

        try {
            WorkspaceMirror.sync(source, mirrorPath, excluded);
        } catch (CancellationException e) {
            return CheckpointResult.failed(CheckpointError.CANCELLED, "Checkpoint creation cancelled");
        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to copy workspace {} into {}", source, mirrorPath, e);
            return CheckpointResult.failed(CheckpointError.IO_FAILURE, "Failed to copy workspace files", e.getMessage());
        }

        ProcessResult add = git.run(mirrorPath, "add", "-A");
        if (!add.success()) {
            return CheckpointResult.failed("Failed to stage files", add);
        }
        String message = "[" + id + "] " + toolName + ": " + description;
        ProcessResult commit = git.run(mirrorPath, "commit", "-q", "--no-verify", "--allow-empty", "-m", message);
        if (!commit.success()) {
            return CheckpointResult.failed("Failed to create checkpoint commit", commit);
        }
        GitResult<String> head = git.headCommit(mirrorPath);
        if (!head.success()) {
            return CheckpointResult.failed("Failed to read checkpoint commit", head);
        }
        GitResult<List<String>> files = git.filesInCommit(mirrorPath, head.value());
        List<String> modified = files.success() ? files.value() : List.of();
        if (!files.success()) {
            log.warn("Could not list files of checkpoint commit {}: {}", head.value(), files.error());
        }

        CheckpointMetadata metadata = new CheckpointMetadata(id, toolCallId, toolName, description,
                clock.instant(), head.value(), modified, lastSequence + 1);
        try {
            JsonRecordFiles.write(metadataFile(id), metadata);
        } catch (IOException e) {
            log.error("Failed to write metadata for checkpoint {}", id, e);
            return CheckpointResult.failed(CheckpointError.IO_FAILURE, "Failed to write checkpoint metadata", e.getMessage());
        }
        lastSequence = metadata.sequence();
        log.info("Created checkpoint {} for {} ({} files changed)", id, toolName, modified.size());

        if (properties.isAutoPrune()) {
            CheckpointResult<Void> pruned = pruneCheckpoints(properties.getMaxCheckpoints());
            if (!pruned.success()) {
                log.warn("Automatic prune failed: {} {}", pruned.errorMessage(), pruned.errorDetails());
            }
        }
        return CheckpointResult.ok(id);
    }

    @Override
    public synchronized CheckpointResult<Void> restoreCheckpoint(String checkpointId) {
        if (!initialized) {
            return notInitialized();
        }
        CheckpointResult<CheckpointMetadata> found = getCheckpoint(checkpointId);
        if (!found.success()) {
            return found.asFailure();
        }
        String commit = found.data().commitHash();

        GitResult<List<String>> tracked = git.trackedFiles(mirrorPath, commit);
        if (!tracked.success()) {
            return CheckpointResult.failed("Failed to list checkpoint files", tracked);
        }
        if (!tracked.value().isEmpty()) {
            ProcessResult checkout = git.run(mirrorPath, "checkout", commit, "--", ".");
            if (!checkout.success()) {
                return CheckpointResult.failed("Failed to check out checkpoint commit", checkout);
            }
        }
        Path target = liveDirectory();
        try {
            WorkspaceMirror.copyFiles(mirrorPath, target, tracked.value());
        } catch (CancellationException e) {
            return CheckpointResult.failed(CheckpointError.CANCELLED, "Checkpoint restore cancelled");
        } catch (IOException e) {
            log.error("Failed to restore checkpoint {} into {}", checkpointId, target, e);
            return CheckpointResult.failed(CheckpointError.IO_FAILURE, "Failed to restore files", e.getMessage());
        }
        log.info("Restored checkpoint {} into {} ({} files)", checkpointId, target, tracked.value().size());
        return CheckpointResult.ok();
    }

    @Override
    public synchronized CheckpointResult<List<CheckpointMetadata>> listCheckpoints(int limit) {
        if (!initialized) {
            return notInitialized();
        }
        try {
            return CheckpointResult.ok(readAllMetadata().stream()
                    .sorted(CheckpointMetadata.NEWEST_FIRST)
                    .limit(Math.max(0, limit))
                    .toList());
        } catch (IOException e) {
            return CheckpointResult.failed(CheckpointError.IO_FAILURE, "Failed to list checkpoints", e.getMessage());
        }
    }

    @Override
    public synchronized CheckpointResult<CheckpointMetadata> getCheckpoint(String checkpointId) {
        if (!initialized) {
            return notInitialized();
        }
        if (checkpointId == null || !CHECKPOINT_ID.matcher(checkpointId).matches()) {
            return CheckpointResult.failed(CheckpointError.NOT_FOUND, "Checkpoint not found", checkpointId);
        }
        Path file = metadataFile(checkpointId);
        if (!Files.isRegularFile(file)) {
            return CheckpointResult.failed(CheckpointError.NOT_FOUND, "Checkpoint not found", checkpointId);
        }
        try {
            return CheckpointResult.ok(JsonRecordFiles.read(file, CheckpointMetadata.class));
        } catch (IOException e) {
            log.warn("Corrupt metadata for checkpoint {}: {}", checkpointId, e.getMessage());
            return CheckpointResult.failed(CheckpointError.SERIALIZATION, "Failed to read checkpoint metadata", e.getMessage());
        }
    }

    @Override
    public synchronized CheckpointResult<Void> pruneCheckpoints(int keepCount) {
        if (!initialized) {
            return notInitialized();
        }
        try {
            List<CheckpointMetadata> stale = readAllMetadata().stream()
                    .sorted(CheckpointMetadata.NEWEST_FIRST)
                    .skip(Math.max(0, keepCount))
                    .toList();
            for (CheckpointMetadata metadata : stale) {
                Files.deleteIfExists(metadataFile(metadata.id()));
            }
            if (!stale.isEmpty()) {
                log.info("Pruned {} checkpoints, kept {}", stale.size(), keepCount);
            }
            return CheckpointResult.ok();
        } catch (IOException e) {
            return CheckpointResult.failed(CheckpointError.IO_FAILURE, "Failed to prune checkpoints", e.getMessage());
        }
    }

    /** The session worktree while tools are redirected there, otherwise the initialized workspace. */
    private Path liveDirectory() {
        if (workspacePath.equals(workingDirectory.getOriginalDirectory())) {
            return workingDirectory.getWorkingDirectory();
        }
        return workspacePath;
    }

    Path mirrorPath() {
        return mirrorPath;
    }

    private Path metadataFile(String id) {
        return metadataPath.resolve(id + ".json");
    }

    /** Every readable metadata file; unreadable ones are logged and skipped. */
    private List<CheckpointMetadata> readAllMetadata() throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.list(metadataPath)) {
            files = stream.filter(p -> p.getFileName().toString().endsWith(".json")).toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        List<CheckpointMetadata> all = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                all.add(JsonRecordFiles.read(file, CheckpointMetadata.class));
            } catch (IOException e) {
                log.warn("Skipping unreadable checkpoint metadata {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return all;
    }

    private static <T> CheckpointResult<T> notInitialized() {
        return CheckpointResult.failed(CheckpointError.NOT_INITIALIZED, "Checkpoint store is not initialized");
    }
}
