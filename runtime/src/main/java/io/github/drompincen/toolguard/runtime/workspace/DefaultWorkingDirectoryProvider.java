package io.github.drompincen.toolguard.runtime.workspace;

import java.nio.file.Path;

public class DefaultWorkingDirectoryProvider implements WorkingDirectoryProvider {

    private final Path originalDirectory;
    private volatile Path overrideDirectory;

    public DefaultWorkingDirectoryProvider(Path originalDirectory) {
        this.originalDirectory = originalDirectory.toAbsolutePath().normalize();
    }

    @Override
    public Path getWorkingDirectory() {
        Path override = overrideDirectory;
        return override != null ? override : originalDirectory;
    }

    @Override
    public void setWorkingDirectory(Path path) {
        this.overrideDirectory = path.toAbsolutePath().normalize();
    }

    @Override
    public void clearOverride() {
        this.overrideDirectory = null;
    }

    @Override
    public Path getOriginalDirectory() {
        return originalDirectory;
    }
}
