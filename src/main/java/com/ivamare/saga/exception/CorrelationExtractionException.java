package com.ivamare.saga.exception;

/**
 * Thrown when no correlation id can be obtained from an event payload.
 *
 * <p>Fatal for the message being processed: the processor propagates it to the transport.
 */
public class CorrelationExtractionException extends SagaException {

    private final String eventType;

    public CorrelationExtractionException(String eventType, String message) {
        super("Cannot extract correlation id from " + eventType + ": " + message);
        this.eventType = eventType;
    }

    public CorrelationExtractionException(String eventType, String message, Throwable cause) {
        super("Cannot extract correlation id from " + eventType + ": " + message, cause);
        this.eventType = eventType;
    }

    public String getEventType() {
        return eventType;
    }
}
