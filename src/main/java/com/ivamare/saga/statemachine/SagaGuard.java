package com.ivamare.saga.statemachine;

import com.ivamare.saga.model.SagaInstance;

/**
 * Condition that must hold for an event handler to run.
 *
 * @param <TData> Saga data type
 * @param <E> Event payload type
 */
@FunctionalInterface
public interface SagaGuard<TData, E> {

    boolean test(SagaInstance<TData> instance, E event);
}
