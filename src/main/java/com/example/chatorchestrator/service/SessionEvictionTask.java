package com.example.chatorchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SessionEvictionTask {

    private static final Logger logger = LoggerFactory.getLogger(SessionEvictionTask.class);

    private final ChatOrchestrator orchestrator;

    public SessionEvictionTask(ChatOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(fixedDelayString = "${app.chat.eviction-check-interval-ms:60000}")
    public void evictIdleSessions() {
        try {
            int evicted = orchestrator.evictIdleSessions();
            if (evicted > 0) {
                logger.info("Evicted {} idle sessions", evicted);
            }
        } catch (Exception e) {
            logger.error("Idle session eviction failed", e);
        }
    }
}
