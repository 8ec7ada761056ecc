package io.github.drompincen.toolguard.runtime.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointError;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointProperties;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointResult;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointService;
import io.github.drompincen.toolguard.runtime.tools.ToolDispatcher;
import io.github.drompincen.toolguard.runtime.tools.ToolResult;
import io.github.drompincen.toolguard.runtime.workspace.DefaultWorkingDirectoryProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ToolCallPipelineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Path WORKSPACE = Path.of("/work/project");

    @Mock
    private ToolDispatcher dispatcher;

    @Mock
    private CheckpointService checkpoints;

    private CheckpointProperties properties;
    private ToolCallPipeline pipeline;

    @BeforeEach
    void setUp() {
        properties = new CheckpointProperties();
        pipeline = new ToolCallPipeline(dispatcher, checkpoints, properties, new DefaultWorkingDirectoryProvider(WORKSPACE));
    }

    @Test
    void checkpointPrecedesMutatingCall() {
        ObjectNode args = MAPPER.createObjectNode().put("file_path", "a.txt").put("content", "x");
        when(checkpoints.isInitialized()).thenReturn(false);
        when(checkpoints.initialize(WORKSPACE)).thenReturn(CheckpointResult.ok("hash"));
        when(checkpoints.createCheckpoint("call-7", "write_file", "Write a.txt")).thenReturn(CheckpointResult.ok("cp-1"));
        when(dispatcher.execute(eq("write_file"), eq(args), any())).thenReturn(ToolResult.success(new TextNode("ok")));

        ToolCallOutcome outcome = pipeline.execute("call-7", "write_file", args);

        assertThat(outcome.checkpointId()).isEqualTo("cp-1");
        assertThat(outcome.diagnostics()).isEmpty();
        assertThat(outcome.result().success()).isTrue();
        InOrder order = inOrder(checkpoints, dispatcher);
        order.verify(checkpoints).createCheckpoint("call-7", "write_file", "Write a.txt");
        order.verify(dispatcher).execute(eq("write_file"), eq(args), any());
    }

    @Test
    void readOnlyCallSkipsCheckpoint() {
        when(dispatcher.execute(eq("read_file"), any(), any())).thenReturn(ToolResult.success(new TextNode("text")));

        ToolCallOutcome outcome = pipeline.execute("call-1", "read_file", MAPPER.createObjectNode());

        assertThat(outcome.checkpointId()).isNull();
        verifyNoInteractions(checkpoints);
    }

    @Test
    void disabledCheckpointingSkipsCheckpoint() {
        properties.setEnabled(false);
        when(dispatcher.execute(eq("write_file"), any(), any())).thenReturn(ToolResult.success(new TextNode("ok")));

        pipeline.execute("call-1", "write_file", MAPPER.createObjectNode());

        verifyNoInteractions(checkpoints);
    }

    @Test
    void checkpointFailureBecomesDiagnosticNotError() {
        when(checkpoints.isInitialized()).thenReturn(true);
        when(checkpoints.createCheckpoint(anyString(), anyString(), anyString()))
                .thenReturn(CheckpointResult.failed(CheckpointError.TOOL_UNAVAILABLE, "Failed to stage files", "git: not found"));
        when(dispatcher.execute(eq("run_shell_command"), any(), any())).thenReturn(ToolResult.success(new TextNode("done")));

        ToolCallOutcome outcome = pipeline.execute("call-2", "run_shell_command",
                MAPPER.createObjectNode().put("command", "make build"));

        assertThat(outcome.result().success()).isTrue();
        assertThat(outcome.checkpointId()).isNull();
        assertThat(outcome.diagnostics()).singleElement().asString()
                .contains("TOOL_UNAVAILABLE").contains("Failed to stage files");
    }

    @Test
    void failedInitializationDegradesToDiagnostic() {
        when(checkpoints.isInitialized()).thenReturn(false);
        when(checkpoints.initialize(WORKSPACE))
                .thenReturn(CheckpointResult.failed(CheckpointError.IO_FAILURE, "Workspace does not exist"));
        when(dispatcher.execute(eq("write_file"), any(), any())).thenReturn(ToolResult.failure("no such dir"));

        ToolCallOutcome outcome = pipeline.execute(null, "write_file", MAPPER.createObjectNode());

        assertThat(outcome.result().isError()).isTrue();
        assertThat(outcome.diagnostics()).hasSize(1);
        verify(checkpoints, never()).createCheckpoint(anyString(), anyString(), anyString());
    }

    @Test
    void responseCarriesCheckpointAndDiagnostics() {
        ToolCallOutcome outcome = new ToolCallOutcome(ToolResult.cancelled("cancelled"), "cp-9", List.of("note"));

        var response = outcome.toResponse();

        assertThat(response.success()).isFalse();
        assertThat(response.userCancelled()).isTrue();
        assertThat(response.checkpointId()).isEqualTo("cp-9");
        assertThat(response.diagnostics()).containsExactly("note");
    }
}
