package com.ivamare.saga.exception;

/**
 * Base exception for all saga engine errors.
 */
public class SagaException extends RuntimeException {

    public SagaException(String message) {
        super(message);
    }

    public SagaException(String message, Throwable cause) {
        super(message, cause);
    }
}
