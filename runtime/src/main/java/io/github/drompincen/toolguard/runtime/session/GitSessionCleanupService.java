package io.github.drompincen.toolguard.runtime.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Resolves sessions a crashed process left live, once the application has started. */
@Component
public class GitSessionCleanupService {

    private static final Logger log = LoggerFactory.getLogger(GitSessionCleanupService.class);

    private final GitSessionService sessionService;
    private final GitSessionProperties properties;

    public GitSessionCleanupService(GitSessionService sessionService, GitSessionProperties properties) {
        this.sessionService = sessionService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void cleanupOrphanedSessions() {
        if (!properties.isEnabled() || !properties.isCleanupOrphanedSessionsOnStartup()) {
            return;
        }
        int resolved = sessionService.recoverOrphanedSessions();
        if (resolved > 0) {
            log.info("Cleaned up {} orphaned session(s)", resolved);
        } else {
            log.debug("No orphaned sessions found");
        }
    }
}
