package io.github.drompincen.toolguard.protocol.api;

import java.time.Instant;
import java.util.List;

public record GitSessionDto(
        String sessionId,
        String branchName,
        String originalBranch,
        String worktreePath,
        SessionState state,
        Instant startedAt,
        Instant lastActivityAt,
        Instant endedAt,
        SessionEndReason endReason,
        String failureReason,
        List<ToolCallCommitDto> commits
) {}
