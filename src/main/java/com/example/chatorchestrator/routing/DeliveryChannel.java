package com.example.chatorchestrator.routing;

import com.example.chatorchestrator.model.ChatMessage;
import com.example.chatorchestrator.model.DeliveryMode;

import java.util.concurrent.CompletableFuture;

/**
 * One delivery path. A channel completes the returned future when the message reached the
 * recipient and completes it exceptionally otherwise; it never throws.
 */
public interface DeliveryChannel {

    DeliveryMode.Kind kind();

    CompletableFuture<Void> deliver(DeliveryMode mode, ChatMessage message, String recipientId);
}
