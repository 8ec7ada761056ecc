package io.github.drompincen.toolguard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.toolguard.protocol.api.ToolRiskProfile;
import io.github.drompincen.toolguard.runtime.tools.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs a command through the platform shell in the current working directory. Interrupting the
 * calling thread kills the whole process tree and yields a user-cancelled result.
 */
public class RunShellCommandTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(RunShellCommandTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_TIMEOUT_SECONDS = 120;

    @Override public String name() { return "run_shell_command"; }
    @Override public String description() { return "Execute a shell command in the workspace"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("command").put("type", "string").put("description", "Shell command to execute");
        props.putObject("timeout_seconds").put("type", "integer")
                .put("description", "Timeout in seconds (default " + DEFAULT_TIMEOUT_SECONDS + ")");
        schema.putArray("required").add("command");
        return schema;
    }

    @Override public JsonNode outputSchema() { return MAPPER.createObjectNode().put("type", "object"); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.EXEC_SHELL); }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (!input.hasNonNull("command") || input.get("command").asText().isBlank()) {
            return ToolResult.failure("Missing required parameter: command");
        }
        String command = input.get("command").asText();
        int timeout = input.hasNonNull("timeout_seconds") ? input.get("timeout_seconds").asInt() : DEFAULT_TIMEOUT_SECONDS;

        Process process;
        try {
            process = new ProcessBuilder(shell(command))
                    .directory(ctx.workingDirectory().toFile())
                    .redirectErrorStream(false)
                    .start();
        } catch (IOException e) {
            return ToolResult.failure("Shell exec failed: " + e.getMessage());
        }

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread stdoutThread = pump(process.getInputStream(), stdout, stream::stdoutDelta, "stdout");
        Thread stderrThread = pump(process.getErrorStream(), stderr, stream::stderrDelta, "stderr");

        try {
            boolean finished = process.waitFor(timeout, TimeUnit.SECONDS);
            if (!finished) {
                destroyTree(process);
                return ToolResult.failure("Command timed out after " + timeout + " seconds");
            }
            stdoutThread.join(1000);
            stderrThread.join(1000);
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            log.info("Cancelled shell command: {}", command);
            return ToolResult.cancelled("Command cancelled");
        }

        String out;
        String err;
        synchronized (stdout) {
            out = stdout.toString();
        }
        synchronized (stderr) {
            err = stderr.toString();
        }
        return ToolResult.success(MAPPER.valueToTree(Map.of(
                "exitCode", process.exitValue(),
                "stdout", out,
                "stderr", err)));
    }

    private static List<String> shell(String command) {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
        return windows ? List.of("cmd", "/c", command) : List.of("sh", "-c", command);
    }

    private static Thread pump(InputStream in, StringBuilder sink, Consumer<String> delta, String streamName) {
        Thread t = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(line).append('\n');
                    }
                    delta.accept(line + "\n");
                }
            } catch (IOException e) {
                log.debug("Shell {} closed early: {}", streamName, e.getMessage());
            }
        }, "shell-" + streamName);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
