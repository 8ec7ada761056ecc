package io.github.drompincen.toolguard.gateway.controller;

import io.github.drompincen.toolguard.protocol.api.CheckpointDto;
import io.github.drompincen.toolguard.runtime.agent.ToolCallPipeline;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointMetadata;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointResult;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/checkpoints")
public class CheckpointController {

    private final CheckpointService checkpoints;
    private final ToolCallPipeline pipeline;

    public CheckpointController(CheckpointService checkpoints, ToolCallPipeline pipeline) {
        this.checkpoints = checkpoints;
        this.pipeline = pipeline;
    }

    @GetMapping
    public ResponseEntity<?> list(@RequestParam(defaultValue = "20") int limit) {
        CheckpointResult<String> init = pipeline.ensureCheckpointsInitialized();
        if (!init.success()) {
            return error(init);
        }
        CheckpointResult<List<CheckpointMetadata>> result = checkpoints.listCheckpoints(limit);
        if (!result.success()) {
            return error(result);
        }
        List<CheckpointDto> dtos = result.data().stream().map(CheckpointMetadata::toDto).toList();
        return ResponseEntity.ok(dtos);
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        CheckpointResult<String> init = pipeline.ensureCheckpointsInitialized();
        if (!init.success()) {
            return error(init);
        }
        CheckpointResult<CheckpointMetadata> result = checkpoints.getCheckpoint(id);
        return result.success() ? ResponseEntity.ok(result.data().toDto()) : error(result);
    }

    @PostMapping("/{id}/restore")
    public ResponseEntity<?> restore(@PathVariable String id) {
        CheckpointResult<String> init = pipeline.ensureCheckpointsInitialized();
        if (!init.success()) {
            return error(init);
        }
        CheckpointResult<Void> result = checkpoints.restoreCheckpoint(id);
        return result.success() ? ResponseEntity.ok(Map.of("restored", id)) : error(result);
    }

    @PostMapping("/prune")
    public ResponseEntity<?> prune(@RequestParam int keep) {
        CheckpointResult<String> init = pipeline.ensureCheckpointsInitialized();
        if (!init.success()) {
            return error(init);
        }
        CheckpointResult<Void> result = checkpoints.pruneCheckpoints(keep);
        return result.success() ? ResponseEntity.ok(Map.of("kept", keep)) : error(result);
    }

    static ResponseEntity<Map<String, String>> error(CheckpointResult<?> result) {
        HttpStatus status = switch (result.error()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NOT_INITIALIZED, DISABLED -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        String message = result.errorMessage() != null ? result.errorMessage() : String.valueOf(result.error());
        return ResponseEntity.status(status).body(Map.of(
                "error", String.valueOf(result.error()),
                "message", message));
    }
}
