package com.example.chatorchestrator.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables of the chat session orchestrator.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "app.chat")
public class ChatProperties {

    /**
     * Maximum participants per session, host and agents included.
     */
    private int maxParticipants = 10;

    /**
     * A user without activity for this long is flipped offline. Membership is kept.
     */
    private Duration presenceTimeout = Duration.ofSeconds(30);

    /**
     * A typing indicator without a refresh for this long is cleared.
     */
    private Duration typingTimeout = Duration.ofSeconds(3);

    /**
     * Upper bound on a single recipient's delivery write.
     */
    private Duration deliveryTimeout = Duration.ofSeconds(5);

    private int messagePageSize = 50;

    /**
     * Routed messages kept in memory for read receipts. Older ones are read back from the store.
     */
    private int messageIndexSize = 1000;

    private int userSessionLimit = 50;

    /**
     * Sessions idle for longer than this, with nobody online, are dropped from memory
     * and re-hydrated from the store on next access.
     */
    private Duration idleEviction = Duration.ofMinutes(30);
}
