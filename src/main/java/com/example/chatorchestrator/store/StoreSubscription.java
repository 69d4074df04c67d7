package com.example.chatorchestrator.store;

/**
 * Handle of a live change-feed subscription.
 */
@FunctionalInterface
public interface StoreSubscription {
    void cancel();
}
