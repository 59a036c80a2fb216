package com.ivamare.saga.exception;

import java.util.UUID;

/**
 * Thrown when a save is rejected because the stored instance changed since it was read,
 * or was removed.
 *
 * <p>The transport is expected to redeliver the message; the next attempt re-reads the
 * current instance.
 */
public class SagaConcurrencyException extends SagaException {

    private final UUID correlationId;
    private final long expectedRevision;

    public SagaConcurrencyException(UUID correlationId, long expectedRevision) {
        super("Saga instance " + correlationId + " was modified concurrently (expected revision "
            + expectedRevision + ")");
        this.correlationId = correlationId;
        this.expectedRevision = expectedRevision;
    }

    public UUID getCorrelationId() {
        return correlationId;
    }

    public long getExpectedRevision() {
        return expectedRevision;
    }
}
