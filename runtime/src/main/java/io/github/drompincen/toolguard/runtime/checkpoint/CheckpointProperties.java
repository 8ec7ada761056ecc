package io.github.drompincen.toolguard.runtime.checkpoint;

import io.github.drompincen.toolguard.runtime.workspace.WorkspacePaths;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "checkpointing")
public class CheckpointProperties {

    public static final String DEFAULT_DIRECTORY = "~/.codepunk/checkpoints";

    private boolean enabled = true;
    private String checkpointDirectory;
    private int maxCheckpoints = 100;
    private boolean autoPrune = true;
    /** Directory names (at any depth) that are never copied into the mirror. */
    private List<String> excludedDirectories = new ArrayList<>(List.of(".git", ".codepunk"));

    public Path resolveCheckpointDirectory() {
        String dir = checkpointDirectory == null || checkpointDirectory.isBlank()
                ? DEFAULT_DIRECTORY : checkpointDirectory;
        return WorkspacePaths.expandHome(dir).toAbsolutePath().normalize();
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getCheckpointDirectory() { return checkpointDirectory; }
    public void setCheckpointDirectory(String checkpointDirectory) { this.checkpointDirectory = checkpointDirectory; }

    public int getMaxCheckpoints() { return maxCheckpoints; }
    public void setMaxCheckpoints(int maxCheckpoints) { this.maxCheckpoints = maxCheckpoints; }

    public boolean isAutoPrune() { return autoPrune; }
    public void setAutoPrune(boolean autoPrune) { this.autoPrune = autoPrune; }

    public List<String> getExcludedDirectories() { return excludedDirectories; }
    public void setExcludedDirectories(List<String> excludedDirectories) { this.excludedDirectories = excludedDirectories; }
}
