package com.example.chatorchestrator.routing;

import com.example.chatorchestrator.exception.DeliveryException;
import com.example.chatorchestrator.model.ChatMessage;
import com.example.chatorchestrator.model.DeliveryMode;
import com.example.chatorchestrator.service.SessionSynchronizer;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Shared fan-out plus a copy in the linked direct session. A recipient counts as delivered
 * only when both writes succeeded.
 */
@Component
public class HybridDeliveryChannel implements DeliveryChannel {

    private final SharedDeliveryChannel shared;
    private final SessionSynchronizer synchronizer;

    public HybridDeliveryChannel(SharedDeliveryChannel shared, SessionSynchronizer synchronizer) {
        this.shared = shared;
        this.synchronizer = synchronizer;
    }

    @Override
    public DeliveryMode.Kind kind() {
        return DeliveryMode.Kind.HYBRID;
    }

    @Override
    public CompletableFuture<Void> deliver(DeliveryMode mode, ChatMessage message, String recipientId) {
        return shared.deliver(mode, message, recipientId).thenRun(() -> {
            SessionSynchronizer.SyncResult result = synchronizer.saveLinkedCopy(mode.getLinkedSessionId(), message);
            if (!result.isSuccess()) {
                throw new DeliveryException("Linked copy to " + mode.getLinkedSessionId() + " failed: " + result.getMessage());
            }
        });
    }
}
