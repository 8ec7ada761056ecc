package io.github.drompincen.toolguard.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.toolguard.protocol.api.LlmToolDefinition;
import io.github.drompincen.toolguard.protocol.api.SessionState;
import io.github.drompincen.toolguard.runtime.session.GitSessionService;
import io.github.drompincen.toolguard.runtime.session.IllegalSessionTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Wraps a {@link ToolDispatcher} with the git session lifecycle: mutating calls lazily start a
 * session, successful mutating calls are committed, failed or cancelled calls only keep the
 * session alive. An exception from the inner dispatcher fails the session and is rethrown.
 */
public class GitSessionToolInterceptor implements ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(GitSessionToolInterceptor.class);

    private final ToolDispatcher inner;
    private final GitSessionService sessions;
    private final boolean autoStartSession;

    public GitSessionToolInterceptor(ToolDispatcher inner, GitSessionService sessions, boolean autoStartSession) {
        this.inner = inner;
        this.sessions = sessions;
        this.autoStartSession = autoStartSession;
    }

    @Override
    public List<Tool> getTools() {
        return inner.getTools();
    }

    @Override
    public Optional<Tool> getTool(String name) {
        return inner.getTool(name);
    }

    @Override
    public List<LlmToolDefinition> getLlmTools() {
        return inner.getLlmTools();
    }

    @Override
    public ToolResult execute(String toolName, JsonNode arguments, ToolStream stream) {
        if (!sessions.isEnabled()) {
            return inner.execute(toolName, arguments, stream);
        }
        sessions.checkForTimeout();
        boolean readOnly = ToolCallClassifier.isReadOnly(toolName);
        if (!readOnly && !sessionActive() && autoStartSession) {
            log.info("Starting git session before mutating tool {}", toolName);
            sessions.beginSession();
        }

        ToolResult result;
        try {
            result = inner.execute(toolName, arguments, stream);
        } catch (RuntimeException e) {
            log.error("Tool execution failed for {}", toolName, e);
            if (sessionActive()) {
                sessions.markAsFailed("Tool " + toolName + " threw exception: " + e.getMessage());
            }
            throw e;
        }

        if (!sessionActive()) {
            return result;
        }
        try {
            if (result.isError() || result.userCancelled() || readOnly) {
                sessions.updateActivity();
            } else {
                sessions.commitToolCall(toolName, ToolCallClassifier.summarize(toolName, arguments));
            }
        } catch (IllegalSessionTransitionException e) {
            log.warn("Session left ACTIVE while {} was running: {}", toolName, e.getMessage());
        }
        return result;
    }

    private boolean sessionActive() {
        return sessions.currentSession().map(s -> s.state() == SessionState.ACTIVE).orElse(false);
    }
}
