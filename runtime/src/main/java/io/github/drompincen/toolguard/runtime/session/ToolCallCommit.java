package io.github.drompincen.toolguard.runtime.session;

import io.github.drompincen.toolguard.protocol.api.ToolCallCommitDto;

import java.time.Instant;
import java.util.List;

public record ToolCallCommit(
        String toolName,
        String summary,
        String commitHash,
        Instant committedAt,
        List<String> filesChanged
) {
    public ToolCallCommit {
        filesChanged = filesChanged == null ? List.of() : List.copyOf(filesChanged);
    }

    public ToolCallCommitDto toDto() {
        return new ToolCallCommitDto(toolName, summary, commitHash, committedAt, filesChanged);
    }
}
