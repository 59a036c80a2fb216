package com.ivamare.saga.exception;

import java.util.UUID;

/**
 * Thrown when creating a saga instance whose correlation id is already stored.
 */
public class DuplicateSagaException extends SagaException {

    private final String sagaType;
    private final UUID correlationId;

    public DuplicateSagaException(String sagaType, UUID correlationId) {
        super("Saga instance " + correlationId + " of type " + sagaType + " already exists");
        this.sagaType = sagaType;
        this.correlationId = correlationId;
    }

    public String getSagaType() {
        return sagaType;
    }

    public UUID getCorrelationId() {
        return correlationId;
    }
}
