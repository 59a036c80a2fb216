package com.ivamare.saga.model;

import java.time.Instant;

/**
 * Error recorded against a saga instance when a handler fails.
 *
 * @param message Error message
 * @param errorType Simple class name of the failure (nullable)
 * @param occurredAt When the error was recorded
 */
public record SagaError(
    String message,
    String errorType,
    Instant occurredAt
) {
    public static SagaError of(Throwable error) {
        return new SagaError(messageOf(error), error.getClass().getSimpleName(), Instant.now());
    }

    /**
     * Message of the error, falling back to its class name when the message is blank.
     */
    public static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getName();
    }
}
