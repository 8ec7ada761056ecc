package io.github.drompincen.toolguard.gateway.controller;

import io.github.drompincen.toolguard.protocol.api.AcceptSessionRequest;
import io.github.drompincen.toolguard.protocol.api.GitSessionDto;
import io.github.drompincen.toolguard.protocol.api.SessionState;
import io.github.drompincen.toolguard.runtime.session.GitSession;
import io.github.drompincen.toolguard.runtime.session.GitSessionService;
import io.github.drompincen.toolguard.runtime.session.IllegalSessionTransitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GitSessionControllerTest {

    @Mock
    private GitSessionService sessionService;

    private GitSessionController controller;

    private final GitSession session = GitSession.started("abc12345", Path.of("/repo"), "ai/session-20260101-000000-abc12345",
            "main", "deadbeef", Path.of("/tmp/codepunk-sessions/repo-abc12345"), Instant.parse("2026-01-01T00:00:00Z"));

    @BeforeEach
    void setUp() {
        controller = new GitSessionController(sessionService);
    }

    @Test
    void noSessionIs204() {
        when(sessionService.currentSession()).thenReturn(Optional.empty());

        assertThat(controller.current().getStatusCode().value()).isEqualTo(204);
    }

    @Test
    void beginReturnsSession() {
        when(sessionService.isEnabled()).thenReturn(true);
        when(sessionService.beginSession()).thenReturn(Optional.of(session));

        ResponseEntity<?> response = controller.begin();

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(((GitSessionDto) response.getBody()).state()).isEqualTo(SessionState.ACTIVE);
    }

    @Test
    void beginWhenDisabledIsConflict() {
        when(sessionService.isEnabled()).thenReturn(false);

        assertThat(controller.begin().getStatusCode().value()).isEqualTo(409);
        verify(sessionService, never()).beginSession();
    }

    @Test
    void acceptPassesCommitMessage() {
        when(sessionService.acceptSession("Add feature")).thenReturn(true);
        when(sessionService.currentSession()).thenReturn(Optional.of(session));

        ResponseEntity<?> response = controller.accept(new AcceptSessionRequest("Add feature"));

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        verify(sessionService).acceptSession("Add feature");
    }

    @Test
    void illegalTransitionMapsToConflict() {
        var e = new IllegalSessionTransitionException(SessionState.ENDED, "discard");

        var response = controller.illegalTransition(e);

        assertThat(response.getStatusCode().value()).isEqualTo(409);
        assertThat(response.getBody().get("error")).isEqualTo("Cannot discard while session is ENDED");
    }
}
