package io.github.drompincen.toolguard.gateway.config;

import io.github.drompincen.toolguard.runtime.git.GitCommandExecutor;
import io.github.drompincen.toolguard.runtime.process.SystemProcessRunner;
import io.github.drompincen.toolguard.runtime.session.GitSessionProperties;
import io.github.drompincen.toolguard.runtime.session.GitSessionService;
import io.github.drompincen.toolguard.runtime.tools.GitSessionToolInterceptor;
import io.github.drompincen.toolguard.runtime.tools.RegistryToolDispatcher;
import io.github.drompincen.toolguard.runtime.tools.ToolDispatcher;
import io.github.drompincen.toolguard.runtime.workspace.DefaultWorkingDirectoryProvider;
import io.github.drompincen.toolguard.runtime.workspace.WorkingDirectoryProvider;
import io.github.drompincen.toolguard.runtime.workspace.WorkspacePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;
import java.time.Clock;

/** Wires the checkpoint store and the git session layer around the tool registry. */
@Configuration
public class SafetyNetConfig {

    private static final Logger log = LoggerFactory.getLogger(SafetyNetConfig.class);

    @Bean
    GitCommandExecutor gitCommandExecutor(@Value("${toolguard.git-executable:git}") String gitExecutable) {
        return new GitCommandExecutor(new SystemProcessRunner(gitExecutable));
    }

    @Bean
    WorkingDirectoryProvider workingDirectoryProvider(@Value("${toolguard.workspace:${user.dir}}") String workspace) {
        Path path = WorkspacePaths.expandHome(workspace);
        log.info("Workspace: {}", path.toAbsolutePath().normalize());
        return new DefaultWorkingDirectoryProvider(path);
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    ToolDispatcher toolDispatcher(RegistryToolDispatcher registryDispatcher,
                                  GitSessionService sessionService,
                                  GitSessionProperties properties) {
        return new GitSessionToolInterceptor(registryDispatcher, sessionService, properties.isAutoStartSession());
    }
}
