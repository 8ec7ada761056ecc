package io.github.drompincen.toolguard.protocol.api;

import java.time.Instant;
import java.util.List;

public record CheckpointDto(
        String id,
        String toolCallId,
        String toolName,
        String description,
        Instant createdAt,
        String commitHash,
        List<String> modifiedFiles
) {}
