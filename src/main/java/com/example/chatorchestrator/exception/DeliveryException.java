package com.example.chatorchestrator.exception;

/**
 * A single recipient could not be reached. Recorded per recipient by the router, never
 * propagated to the caller.
 */
public class DeliveryException extends RuntimeException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
