package io.github.drompincen.toolguard.gateway.controller;

import io.github.drompincen.toolguard.protocol.api.CheckpointDto;
import io.github.drompincen.toolguard.runtime.agent.ToolCallPipeline;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointError;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointMetadata;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointResult;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CheckpointControllerTest {

    @Mock
    private CheckpointService checkpoints;
    @Mock
    private ToolCallPipeline pipeline;

    private CheckpointController controller;

    @BeforeEach
    void setUp() {
        controller = new CheckpointController(checkpoints, pipeline);
    }

    @Test
    @SuppressWarnings("unchecked")
    void listReturnsDtos() {
        CheckpointMetadata metadata = new CheckpointMetadata("cp1", "call-1", "write_file", "Write a.txt",
                Instant.parse("2026-01-01T00:00:00Z"), "abc", List.of("a.txt"), 1);
        when(pipeline.ensureCheckpointsInitialized()).thenReturn(CheckpointResult.ok("hash"));
        when(checkpoints.listCheckpoints(5)).thenReturn(CheckpointResult.ok(List.of(metadata)));

        ResponseEntity<?> response = controller.list(5);

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        List<CheckpointDto> body = (List<CheckpointDto>) response.getBody();
        assertThat(body).extracting(CheckpointDto::id).containsExactly("cp1");
    }

    @Test
    void uninitializedStoreIsConflict() {
        when(pipeline.ensureCheckpointsInitialized())
                .thenReturn(CheckpointResult.failed(CheckpointError.DISABLED, "Checkpointing is disabled"));

        ResponseEntity<?> response = controller.list(20);

        assertThat(response.getStatusCode().value()).isEqualTo(409);
        verify(checkpoints, never()).listCheckpoints(anyInt());
    }

    @Test
    void unknownCheckpointIs404() {
        when(pipeline.ensureCheckpointsInitialized()).thenReturn(CheckpointResult.ok("hash"));
        when(checkpoints.restoreCheckpoint("missing"))
                .thenReturn(CheckpointResult.failed(CheckpointError.NOT_FOUND, "Checkpoint not found"));

        ResponseEntity<?> response = controller.restore("missing");

        assertThat(response.getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void gitFailureIs500() {
        when(pipeline.ensureCheckpointsInitialized()).thenReturn(CheckpointResult.ok("hash"));
        when(checkpoints.pruneCheckpoints(3))
                .thenReturn(CheckpointResult.failed(CheckpointError.IO_FAILURE, "disk full"));

        ResponseEntity<?> response = controller.prune(3);

        assertThat(response.getStatusCode().value()).isEqualTo(500);
    }
}
