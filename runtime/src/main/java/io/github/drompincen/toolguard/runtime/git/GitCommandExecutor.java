package io.github.drompincen.toolguard.runtime.git;

import io.github.drompincen.toolguard.runtime.process.ProcessResult;
import io.github.drompincen.toolguard.runtime.process.ProcessRunner;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Typed git queries on top of a {@link ProcessRunner}. Every call names the directory it runs
 * in, so the same executor serves the user's checkout, session worktrees and shadow mirrors.
 */
public class GitCommandExecutor {

    private final ProcessRunner runner;

    public GitCommandExecutor(ProcessRunner runner) {
        this.runner = runner;
    }

    public ProcessResult run(Path directory, String... arguments) {
        return runner.execute(Arrays.asList(arguments), directory);
    }

    public ProcessResult run(Path directory, List<String> arguments) {
        return runner.execute(arguments, directory);
    }

    public GitResult<Boolean> isRepository(Path directory) {
        ProcessResult result = run(directory, "rev-parse", "--is-inside-work-tree");
        if (result.kind() != ProcessResult.Kind.COMPLETED) {
            return GitResult.failed(result);
        }
        return GitResult.ok(result.success() && "true".equals(result.output().trim()));
    }

    public GitResult<String> currentBranch(Path directory) {
        ProcessResult result = run(directory, "branch", "--show-current");
        if (!result.success()) {
            return GitResult.failed(result);
        }
        String branch = result.output().trim();
        if (branch.isEmpty()) {
            return GitResult.failed("Not on any branch (detached HEAD)", 0, GitFailure.COMMAND_FAILED);
        }
        return GitResult.ok(branch);
    }

    /** Path of {@code directory} relative to the repository top level, empty at the top level. */
    public GitResult<String> repositoryPrefix(Path directory) {
        ProcessResult result = run(directory, "rev-parse", "--show-prefix");
        return result.success() ? GitResult.ok(result.output().trim()) : GitResult.failed(result);
    }

    public GitResult<String> headCommit(Path directory) {
        ProcessResult result = run(directory, "rev-parse", "HEAD");
        return result.success() ? GitResult.ok(result.output().trim()) : GitResult.failed(result);
    }

    public GitResult<Boolean> hasUncommittedChanges(Path directory) {
        ProcessResult result = run(directory, "status", "--porcelain");
        return result.success() ? GitResult.ok(!result.output().isBlank()) : GitResult.failed(result);
    }

    /** {@code diff --cached --quiet} exits 1 when something is staged. */
    public GitResult<Boolean> hasStagedChanges(Path directory) {
        ProcessResult result = run(directory, "diff", "--cached", "--quiet");
        if (result.kind() != ProcessResult.Kind.COMPLETED || result.exitCode() > 1) {
            return GitResult.failed(result);
        }
        return GitResult.ok(result.exitCode() == 1);
    }

    /** Paths touched by the given commit relative to its parent; root commits list every file. */
    public GitResult<List<String>> filesInCommit(Path directory, String ref) {
        ProcessResult result = run(directory, "-c", "core.quotepath=false", "show", "--name-only", "--pretty=format:", ref);
        return result.success() ? GitResult.ok(lines(result.output())) : GitResult.failed(result);
    }

    /** Every file present in the tree of the given commit. */
    public GitResult<List<String>> trackedFiles(Path directory, String ref) {
        ProcessResult result = run(directory, "-c", "core.quotepath=false", "ls-tree", "-r", "--name-only", ref);
        return result.success() ? GitResult.ok(lines(result.output())) : GitResult.failed(result);
    }

    static List<String> lines(String output) {
        if (output == null || output.isBlank()) {
            return List.of();
        }
        return output.lines()
                .map(String::trim)
                .filter(l -> !l.isEmpty())
                .toList();
    }
}
