package io.github.drompincen.toolguard.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.toolguard.protocol.api.ToolRiskProfile;
import io.github.drompincen.toolguard.runtime.GitTestSupport;
import io.github.drompincen.toolguard.runtime.MutableClock;
import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointProperties;
import io.github.drompincen.toolguard.runtime.checkpoint.ShadowCheckpointStore;
import io.github.drompincen.toolguard.runtime.git.GitCommandExecutor;
import io.github.drompincen.toolguard.runtime.process.SystemProcessRunner;
import io.github.drompincen.toolguard.runtime.session.GitSessionManager;
import io.github.drompincen.toolguard.runtime.session.GitSessionProperties;
import io.github.drompincen.toolguard.runtime.session.GitSessionStateStore;
import io.github.drompincen.toolguard.runtime.tools.*;
import io.github.drompincen.toolguard.runtime.workspace.DefaultWorkingDirectoryProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.Mockito.mock;

/** Checkpoints and git sessions working on the same workspace. */
class SafetyNetIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path repo;
    private DefaultWorkingDirectoryProvider workingDirectory;
    private ShadowCheckpointStore checkpoints;
    private ToolCallPipeline pipeline;

    @BeforeEach
    void setUp() throws IOException {
        assumeTrue(GitTestSupport.gitAvailable(), "git is not installed");
        repo = GitTestSupport.initRepository(tempDir.resolve("project"));
        Files.writeString(repo.resolve("A.txt"), "1");
        GitTestSupport.git(repo, "add", "A.txt");
        GitTestSupport.git(repo, "commit", "-q", "-m", "add A");

        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        GitCommandExecutor git = new GitCommandExecutor(new SystemProcessRunner("git"));
        workingDirectory = new DefaultWorkingDirectoryProvider(repo);

        CheckpointProperties checkpointProperties = new CheckpointProperties();
        checkpointProperties.setCheckpointDirectory(tempDir.resolve("checkpoints").toString());
        checkpointProperties.setAutoPrune(false);
        checkpoints = new ShadowCheckpointStore(checkpointProperties, git, workingDirectory, clock);

        GitSessionProperties sessionProperties = new GitSessionProperties();
        sessionProperties.setWorktreeBasePath(tempDir.resolve("worktrees").toString());
        sessionProperties.setStateStorePath(tempDir.resolve("state").toString());
        GitSessionManager sessions = new GitSessionManager(sessionProperties, git,
                new GitSessionStateStore(sessionProperties), workingDirectory, clock);

        ToolRegistry registry = new ToolRegistry(mock(ApplicationContext.class));
        registry.register(new WriteTool());
        ToolDispatcher dispatcher = new GitSessionToolInterceptor(
                new RegistryToolDispatcher(registry, workingDirectory), sessions, true);
        pipeline = new ToolCallPipeline(dispatcher, checkpoints, checkpointProperties, workingDirectory);
    }

    @Test
    void checkpointsFollowTheSessionWorktree() throws IOException {
        pipeline.execute("call-1", "write_file", write("A.txt", "2"));
        ToolCallOutcome second = pipeline.execute("call-2", "write_file", write("A.txt", "3"));

        Path worktree = workingDirectory.getWorkingDirectory();
        assertThat(worktree).isNotEqualTo(repo);
        assertThat(worktree.resolve("A.txt")).hasContent("3");
        assertThat(repo.resolve("A.txt")).hasContent("1");
        assertThat(checkpoints.getCheckpoint(second.checkpointId()).data().modifiedFiles()).containsExactly("A.txt");

        Files.writeString(repo.resolve("A.txt"), "user-edit");
        assertThat(checkpoints.restoreCheckpoint(second.checkpointId()).success()).isTrue();

        assertThat(worktree.resolve("A.txt")).hasContent("2");
        assertThat(repo.resolve("A.txt")).hasContent("user-edit");
    }

    private static ObjectNode write(String path, String content) {
        return MAPPER.createObjectNode().put("file_path", path).put("content", content);
    }

    private static class WriteTool implements Tool {
        @Override public String name() { return "write_file"; }
        @Override public String description() { return "Write a file"; }
        @Override public JsonNode inputSchema() { return MAPPER.createObjectNode().put("type", "object"); }
        @Override public JsonNode outputSchema() { return null; }
        @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.WRITE_FILES); }

        @Override
        public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
            try {
                Files.writeString(ctx.resolve(input.get("file_path").asText()), input.get("content").asText());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return ToolResult.success(new TextNode("written"));
        }
    }
}
