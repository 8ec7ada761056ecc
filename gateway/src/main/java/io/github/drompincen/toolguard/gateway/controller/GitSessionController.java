package io.github.drompincen.toolguard.gateway.controller;

import io.github.drompincen.toolguard.protocol.api.AcceptSessionRequest;
import io.github.drompincen.toolguard.runtime.session.GitSession;
import io.github.drompincen.toolguard.runtime.session.GitSessionService;
import io.github.drompincen.toolguard.runtime.session.IllegalSessionTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/git-session")
public class GitSessionController {

    private static final Logger log = LoggerFactory.getLogger(GitSessionController.class);

    private final GitSessionService sessionService;

    public GitSessionController(GitSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping
    public ResponseEntity<?> current() {
        return sessionService.currentSession()
                .map(s -> ResponseEntity.ok(s.toDto()))
                .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/begin")
    public ResponseEntity<?> begin() {
        if (!sessionService.isEnabled()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "Git sessions are disabled"));
        }
        Optional<GitSession> session = sessionService.beginSession();
        if (session.isEmpty()) {
            return ResponseEntity.unprocessableEntity()
                    .body(Map.of("error", "Workspace is not a git repository on a checked-out branch"));
        }
        return ResponseEntity.ok(session.get().toDto());
    }

    @PostMapping("/accept")
    public ResponseEntity<?> accept(@RequestBody(required = false) AcceptSessionRequest req) {
        String message = req != null ? req.commitMessage() : null;
        if (!sessionService.acceptSession(message)) {
            return ResponseEntity.internalServerError().body(Map.of("error", "Failed to accept session"));
        }
        return current();
    }

    @PostMapping("/discard")
    public ResponseEntity<?> discard() {
        if (!sessionService.discardSession()) {
            return ResponseEntity.internalServerError().body(Map.of("error", "Failed to discard session"));
        }
        return current();
    }

    @ExceptionHandler(IllegalSessionTransitionException.class)
    public ResponseEntity<Map<String, String>> illegalTransition(IllegalSessionTransitionException e) {
        log.debug("Rejected session request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }
}
