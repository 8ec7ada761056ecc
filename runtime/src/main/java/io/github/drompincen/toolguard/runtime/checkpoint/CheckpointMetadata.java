package io.github.drompincen.toolguard.runtime.checkpoint;

import io.github.drompincen.toolguard.protocol.api.CheckpointDto;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Persisted record of one checkpoint. {@code sequence} grows by one per checkpoint of a mirror
 * and gives a total order even when two checkpoints share a timestamp.
 */
public record CheckpointMetadata(
        String id,
        String toolCallId,
        String toolName,
        String description,
        Instant createdAt,
        String commitHash,
        List<String> modifiedFiles,
        long sequence
) {
    public static final Comparator<CheckpointMetadata> NEWEST_FIRST =
            Comparator.comparingLong(CheckpointMetadata::sequence)
                    .thenComparing(CheckpointMetadata::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .reversed();

    public CheckpointMetadata {
        modifiedFiles = modifiedFiles == null ? List.of() : List.copyOf(modifiedFiles);
    }

    public CheckpointDto toDto() {
        return new CheckpointDto(id, toolCallId, toolName, description, createdAt, commitHash, modifiedFiles);
    }
}
