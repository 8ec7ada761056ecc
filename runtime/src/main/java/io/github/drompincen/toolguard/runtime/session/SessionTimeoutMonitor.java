package io.github.drompincen.toolguard.runtime.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@EnableScheduling
public class SessionTimeoutMonitor {

    private static final Logger log = LoggerFactory.getLogger(SessionTimeoutMonitor.class);

    private final GitSessionService sessionService;

    public SessionTimeoutMonitor(GitSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Scheduled(fixedDelayString = "${git-session.timeout-check-interval-ms:60000}")
    public void checkTimeouts() {
        if (!sessionService.isEnabled()) {
            return;
        }
        try {
            if (sessionService.checkForTimeout()) {
                log.info("Idle session timed out");
            }
        } catch (RuntimeException e) {
            log.error("Session timeout check failed", e);
        }
    }
}
