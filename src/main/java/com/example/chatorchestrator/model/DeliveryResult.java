package com.example.chatorchestrator.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Outcome of routing one message. A partial failure is reported here, never thrown.
 */
@Getter
@ToString
public class DeliveryResult {

    public enum Status { DELIVERED, PARTIAL_FAILURE, FAILED, NO_RECIPIENTS }

    private final String messageId;
    private final List<String> deliveredTo;
    private final List<FailedDelivery> failedDeliveries;

    public DeliveryResult(String messageId, List<String> deliveredTo, List<FailedDelivery> failedDeliveries) {
        this.messageId = messageId;
        this.deliveredTo = List.copyOf(deliveredTo);
        this.failedDeliveries = List.copyOf(failedDeliveries);
    }

    public Status getStatus() {
        if (failedDeliveries.isEmpty()) {
            return deliveredTo.isEmpty() ? Status.NO_RECIPIENTS : Status.DELIVERED;
        }
        return deliveredTo.isEmpty() ? Status.FAILED : Status.PARTIAL_FAILURE;
    }

    public boolean isDelivered() {
        return failedDeliveries.isEmpty();
    }

    public Map<String, Object> toMap() {
        return Map.of(
            "messageId", messageId,
            "status", getStatus().name(),
            "deliveredTo", deliveredTo,
            "failedDeliveries", failedDeliveries.stream()
                    .map(f -> Map.of("userId", f.getUserId(), "error", f.getError()))
                    .toList()
        );
    }
}
