package io.github.drompincen.toolguard.runtime;

import io.github.drompincen.toolguard.runtime.process.ProcessResult;
import io.github.drompincen.toolguard.runtime.process.SystemProcessRunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** Helpers for tests that drive a real git binary. */
public final class GitTestSupport {

    private static final SystemProcessRunner GIT = new SystemProcessRunner("git");

    private GitTestSupport() {}

    public static boolean gitAvailable() {
        return GIT.execute(List.of("--version"), Path.of(".").toAbsolutePath()).success();
    }

    public static String git(Path dir, String... args) {
        ProcessResult result = GIT.execute(Arrays.asList(args), dir);
        assertThat(result.success())
                .as("git %s failed: %s", String.join(" ", args), result.errorOrOutput())
                .isTrue();
        return result.output();
    }

    /** A repository on branch {@code main} with one commit containing README.md. */
    public static Path initRepository(Path dir) throws IOException {
        Files.createDirectories(dir);
        git(dir, "init", "-q");
        git(dir, "symbolic-ref", "HEAD", "refs/heads/main");
        git(dir, "config", "user.name", "Test User");
        git(dir, "config", "user.email", "test@example.com");
        git(dir, "config", "commit.gpgsign", "false");
        Files.writeString(dir.resolve("README.md"), "# demo\n");
        git(dir, "add", "README.md");
        git(dir, "commit", "-q", "-m", "initial");
        return dir;
    }

    public static boolean branchExists(Path repo, String branch) {
        return GIT.execute(Arrays.asList("rev-parse", "--verify", "--quiet", "refs/heads/" + branch), repo).success();
    }
}
