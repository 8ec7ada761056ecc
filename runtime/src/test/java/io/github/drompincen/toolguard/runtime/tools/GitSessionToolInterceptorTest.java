package io.github.drompincen.toolguard.runtime.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.toolguard.protocol.api.SessionState;
import io.github.drompincen.toolguard.runtime.session.GitSession;
import io.github.drompincen.toolguard.runtime.session.GitSessionService;
import io.github.drompincen.toolguard.runtime.session.IllegalSessionTransitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GitSessionToolInterceptorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private ToolDispatcher inner;

    @Mock
    private GitSessionService sessions;

    private GitSessionToolInterceptor interceptor;
    private GitSession active;

    @BeforeEach
    void setUp() {
        interceptor = new GitSessionToolInterceptor(inner, sessions, true);
        active = GitSession.started("s-1", Path.of("/work/repo"), "ai/session-x", "main", "abc",
                Path.of("/tmp/wt"), Instant.parse("2026-03-01T10:00:00Z"));
    }

    @Test
    void disabledSessionsDelegateUntouched() {
        ToolResult ok = ToolResult.success(new TextNode("done"));
        when(sessions.isEnabled()).thenReturn(false);
        when(inner.execute(eq("write_file"), any(), any())).thenReturn(ok);

        ToolResult result = interceptor.execute("write_file", args("file_path", "a.txt"));

        assertThat(result).isSameAs(ok);
        verify(sessions, never()).beginSession();
        verify(sessions, never()).commitToolCall(anyString(), anyString());
    }

    @Test
    void readOnlyToolNeverStartsSession() {
        when(sessions.isEnabled()).thenReturn(true);
        when(inner.execute(eq("read_file"), any(), any())).thenReturn(ToolResult.success(new TextNode("text")));

        interceptor.execute("read_file", args("path", "a.txt"));

        verify(sessions, never()).beginSession();
        verify(sessions, never()).commitToolCall(anyString(), anyString());
    }

    @Test
    void mutatingToolStartsSessionAndCommitsSummary() {
        when(sessions.isEnabled()).thenReturn(true);
        when(sessions.currentSession()).thenReturn(Optional.empty(), Optional.of(active));
        when(inner.execute(eq("write_file"), any(), any())).thenReturn(ToolResult.success(new TextNode("ok")));

        ToolResult result = interceptor.execute("write_file", args("file_path", "src/a.txt"));

        assertThat(result.success()).isTrue();
        var order = inOrder(sessions, inner);
        order.verify(sessions).beginSession();
        order.verify(inner).execute(eq("write_file"), any(), any());
        order.verify(sessions).commitToolCall("write_file", "Write src/a.txt");
    }

    @Test
    void autoStartOffLeavesSessionAlone() {
        interceptor = new GitSessionToolInterceptor(inner, sessions, false);
        when(sessions.isEnabled()).thenReturn(true);
        when(inner.execute(eq("write_file"), any(), any())).thenReturn(ToolResult.success(new TextNode("ok")));

        interceptor.execute("write_file", args("file_path", "a.txt"));

        verify(sessions, never()).beginSession();
    }

    @Test
    void errorResultOnlyUpdatesActivity() {
        when(sessions.isEnabled()).thenReturn(true);
        when(sessions.currentSession()).thenReturn(Optional.of(active));
        ToolResult failed = ToolResult.failure("disk full");
        when(inner.execute(eq("write_file"), any(), any())).thenReturn(failed);

        ToolResult result = interceptor.execute("write_file", args("file_path", "a.txt"));

        assertThat(result).isSameAs(failed);
        verify(sessions).updateActivity();
        verify(sessions, never()).commitToolCall(anyString(), anyString());
    }

    @Test
    void cancelledResultOnlyUpdatesActivity() {
        when(sessions.isEnabled()).thenReturn(true);
        when(sessions.currentSession()).thenReturn(Optional.of(active));
        when(inner.execute(eq("run_shell_command"), any(), any())).thenReturn(ToolResult.cancelled("cancelled"));

        ToolResult result = interceptor.execute("run_shell_command", args("command", "sleep 100"));

        assertThat(result.userCancelled()).isTrue();
        verify(sessions).updateActivity();
        verify(sessions, never()).commitToolCall(anyString(), anyString());
    }

    @Test
    void exceptionFailsSessionAndPropagates() {
        when(sessions.isEnabled()).thenReturn(true);
        when(sessions.currentSession()).thenReturn(Optional.empty(), Optional.of(active));
        when(inner.execute(eq("write_file"), any(), any())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> interceptor.execute("write_file", args("file_path", "a.txt")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");

        verify(sessions).markAsFailed(contains("boom"));
        verify(sessions, never()).commitToolCall(anyString(), anyString());
    }

    @Test
    void sessionEndingMidCallDoesNotLoseResult() {
        when(sessions.isEnabled()).thenReturn(true);
        when(sessions.currentSession()).thenReturn(Optional.of(active));
        when(inner.execute(eq("write_file"), any(), any())).thenReturn(ToolResult.success(new TextNode("ok")));
        when(sessions.commitToolCall(anyString(), anyString()))
                .thenThrow(new IllegalSessionTransitionException(SessionState.TIMED_OUT, "commit a tool call"));

        ToolResult result = interceptor.execute("write_file", args("file_path", "a.txt"));

        assertThat(result.success()).isTrue();
    }

    @Test
    void listingMethodsDelegate() {
        interceptor.getTools();
        interceptor.getTool("read_file");
        interceptor.getLlmTools();

        verify(inner).getTools();
        verify(inner).getTool("read_file");
        verify(inner).getLlmTools();
        verifyNoInteractions(sessions);
    }

    private static ObjectNode args(String key, String value) {
        return MAPPER.createObjectNode().put(key, value);
    }
}
