package io.github.drompincen.toolguard.runtime.session;

import io.github.drompincen.toolguard.protocol.api.SessionState;

public class IllegalSessionTransitionException extends IllegalStateException {

    private final SessionState from;

    public IllegalSessionTransitionException(SessionState from, String operation) {
        super("Cannot " + operation + " while session is " + from);
        this.from = from;
    }

    public SessionState getFrom() {
        return from;
    }
}
