package com.ivamare.saga.processor;

/**
 * Outcome of processing one message for one saga type.
 */
public enum SagaProcessingResult {
    /** Handlers ran and the instance was saved */
    HANDLED,

    /** The instance had no handler for the event in its current state; nothing was saved */
    NOT_HANDLED,

    /** No instance exists and the event cannot start one; the not-found handler was invoked */
    SAGA_NOT_FOUND,

    /** The instance is completed or faulted; the event was ignored */
    INSTANCE_TERMINAL
}
