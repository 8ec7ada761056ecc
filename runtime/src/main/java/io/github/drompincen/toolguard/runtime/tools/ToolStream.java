package io.github.drompincen.toolguard.runtime.tools;

public interface ToolStream {

    void stdoutDelta(String text);

    void stderrDelta(String text);

    void progress(int percent, String message);

    void artifactCreated(String type, String uriOrRef);

    static ToolStream noop() {
        return new ToolStream() {
            @Override public void stdoutDelta(String text) {}
            @Override public void stderrDelta(String text) {}
            @Override public void progress(int percent, String message) {}
            @Override public void artifactCreated(String type, String uriOrRef) {}
        };
    }
}
