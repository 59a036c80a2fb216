package com.ivamare.saga.exception;

/**
 * Thrown when an invalid lifecycle operation is attempted on a saga instance,
 * such as transitioning a completed instance.
 */
public class InvalidSagaOperationException extends SagaException {

    public InvalidSagaOperationException(String message) {
        super(message);
    }
}
