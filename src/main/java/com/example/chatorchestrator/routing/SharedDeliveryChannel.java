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
 * Shared sessions: recipients are written in parallel through the synchronizer's fan-out.
 */
@Component
public class SharedDeliveryChannel implements DeliveryChannel {

    private final SessionSynchronizer synchronizer;
    private final ExecutorService executor = Executors.newFixedThreadPool(4, r -> {
        Thread t = new Thread(r, "shared-delivery");
        t.setDaemon(true);
        return t;
    });

    public SharedDeliveryChannel(SessionSynchronizer synchronizer) {
        this.synchronizer = synchronizer;
    }

    @Override
    public DeliveryMode.Kind kind() {
        return DeliveryMode.Kind.SHARED;
    }

    @Override
    public CompletableFuture<Void> deliver(DeliveryMode mode, ChatMessage message, String recipientId) {
        return CompletableFuture.runAsync(() -> {
            SessionSynchronizer.SyncResult result = synchronizer.fanOutDelivery(message, recipientId);
            if (!result.isSuccess()) {
                throw new DeliveryException("Fan-out write failed: " + result.getMessage());
            }
        }, executor);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
