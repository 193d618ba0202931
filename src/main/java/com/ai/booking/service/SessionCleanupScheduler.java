package com.ai.booking.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops chat sessions that have been idle longer than {@code booking.session-timeout}.
 */
@Component
public class SessionCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionCleanupScheduler.class);

    private final ConversationOrchestrator orchestrator;

    public SessionCleanupScheduler(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(fixedDelayString = "${booking.session-cleanup-interval-ms:60000}")
    public void evictIdleSessions() {
        int removed = orchestrator.evictIdleSessions();
        if (removed > 0) {
            log.info("Evicted {} idle sessions", removed);
        }
    }
}
