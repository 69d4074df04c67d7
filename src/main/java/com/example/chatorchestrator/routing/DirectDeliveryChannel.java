package com.example.chatorchestrator.routing;

import com.example.chatorchestrator.exception.DeliveryException;
import com.example.chatorchestrator.model.ChatMessage;
import com.example.chatorchestrator.model.DeliveryMode;
import com.example.chatorchestrator.service.SessionSynchronizer;
import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Direct sessions: deliveries go one at a time through a single thread into the
 * recipient's inbox.
 */
@Component
public class DirectDeliveryChannel implements DeliveryChannel {

    private final SessionSynchronizer synchronizer;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "direct-delivery");
        t.setDaemon(true);
        return t;
    });

    public DirectDeliveryChannel(SessionSynchronizer synchronizer) {
        this.synchronizer = synchronizer;
    }

    @Override
    public DeliveryMode.Kind kind() {
        return DeliveryMode.Kind.DIRECT;
    }

    @Override
    public CompletableFuture<Void> deliver(DeliveryMode mode, ChatMessage message, String recipientId) {
        return CompletableFuture.runAsync(() -> {
            SessionSynchronizer.SyncResult result = synchronizer.saveInboxEntry(recipientId, message);
            if (!result.isSuccess()) {
                throw new DeliveryException("Inbox write failed: " + result.getMessage());
            }
        }, executor);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
