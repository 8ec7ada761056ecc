package io.github.drompincen.toolguard.protocol.api;

import java.time.Instant;
import java.util.List;

public record ToolCallCommitDto(
        String toolName,
        String summary,
        String commitHash,
        Instant committedAt,
        List<String> filesChanged
) {}
