package io.github.drompincen.toolguard.runtime.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}. The executable is looked up on the
 * {@code PATH} once and cached; if it cannot be found the bare name is used and the operating
 * system gets the final say.
 *
 * <p>Interrupting the calling thread cancels the run: the whole process tree is destroyed, the
 * interrupt flag is restored and {@link ProcessResult#cancelled()} is returned.
 */
public class SystemProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(SystemProcessRunner.class);
    private static final long READER_JOIN_MS = 5_000;

    private final String executable;
    private volatile String resolvedExecutable;

    public SystemProcessRunner(String executable) {
        this.executable = executable;
    }

    @Override
    public ProcessResult execute(List<String> arguments, Path workingDirectory) {
        if (Thread.currentThread().isInterrupted()) {
            return ProcessResult.cancelled();
        }

        List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add(resolvedExecutable());
        command.addAll(arguments);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(false)
                    .start();
        } catch (IOException | SecurityException e) {
            log.error("Failed to start {} {} in {}", executable, String.join(" ", arguments), workingDirectory, e);
            return ProcessResult.startFailed("Failed to start " + executable + ": " + e.getMessage());
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", executable, e.getMessage());
        }

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread stdoutThread = startReader(process.getInputStream(), stdout, "stdout");
        Thread stderrThread = startReader(process.getErrorStream(), stderr, "stderr");

        int exitCode;
        try {
            exitCode = process.waitFor();
            stdoutThread.join(READER_JOIN_MS);
            stderrThread.join(READER_JOIN_MS);
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            log.warn("{} {} cancelled", executable, String.join(" ", arguments));
            return ProcessResult.cancelled();
        }

        String output;
        String error;
        synchronized (stdout) {
            output = stdout.toString().trim();
        }
        synchronized (stderr) {
            error = stderr.toString().trim();
        }
        if (exitCode != 0) {
            log.warn("Command failed: {} {} (exit code {})", executable, String.join(" ", arguments), exitCode);
        }
        return ProcessResult.completed(exitCode, output, error);
    }

    String resolvedExecutable() {
        String resolved = resolvedExecutable;
        if (resolved == null) {
            resolved = findOnPath(executable);
            resolvedExecutable = resolved;
            log.debug("Resolved {} to {}", executable, resolved);
        }
        return resolved;
    }

    static String findOnPath(String name) {
        if (name.contains("/") || name.contains(File.separator)) {
            return name;
        }
        String path = System.getenv("PATH");
        if (path == null || path.isBlank()) {
            return name;
        }
        List<String> candidates = new ArrayList<>();
        candidates.add(name);
        if (isWindows()) {
            String pathExt = System.getenv("PATHEXT");
            for (String ext : (pathExt != null ? pathExt : ".EXE;.CMD;.BAT").split(";")) {
                if (!ext.isBlank()) {
                    candidates.add(name + ext.toLowerCase(Locale.ROOT));
                }
            }
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            for (String candidate : candidates) {
                Path file = Path.of(dir, candidate);
                if (Files.isRegularFile(file) && Files.isExecutable(file)) {
                    return file.toAbsolutePath().toString();
                }
            }
        }
        return name;
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }

    private Thread startReader(InputStream in, StringBuilder sink, String streamName) {
        Thread t = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(line).append('\n');
                    }
                }
            } catch (IOException e) {
                log.debug("{} {} stream closed early: {}", executable, streamName, e.getMessage());
            }
        }, executable + "-" + streamName);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
