package io.github.drompincen.toolguard.runtime.process;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one external executable to completion. Ordinary failures (non-zero exit, missing binary,
 * interruption) are reported through the returned {@link ProcessResult}, never thrown.
 */
public interface ProcessRunner {

    ProcessResult execute(List<String> arguments, Path workingDirectory);
}
