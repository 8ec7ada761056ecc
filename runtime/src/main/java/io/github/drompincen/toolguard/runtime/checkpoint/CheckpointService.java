package io.github.drompincen.toolguard.runtime.checkpoint;

import java.nio.file.Path;
import java.util.List;

/**
 * Repository-agnostic rollback points for a workspace. No method throws for ordinary failures;
 * callers inspect the returned {@link CheckpointResult}.
 */
public interface CheckpointService {

    /** Prepares the shadow mirror for the workspace and returns its identity hash. */
    CheckpointResult<String> initialize(Path workspacePath);

    boolean isInitialized();

    /** Snapshots the whole workspace and returns the new checkpoint id. */
    CheckpointResult<String> createCheckpoint(String toolCallId, String toolName, String description);

    CheckpointResult<Void> restoreCheckpoint(String checkpointId);

    /** At most {@code limit} checkpoints, newest first. */
    CheckpointResult<List<CheckpointMetadata>> listCheckpoints(int limit);

    CheckpointResult<CheckpointMetadata> getCheckpoint(String checkpointId);

    /** Drops the metadata of all but the {@code keepCount} most recent checkpoints. */
    CheckpointResult<Void> pruneCheckpoints(int keepCount);
}
