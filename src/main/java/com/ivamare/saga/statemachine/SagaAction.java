package com.ivamare.saga.statemachine;

/**
 * Side effect executed when an event handler runs.
 *
 * <p>Any exception thrown faults the saga instance and is re-thrown to the caller unchanged.
 *
 * @param <TData> Saga data type
 * @param <E> Event payload type
 */
@FunctionalInterface
public interface SagaAction<TData, E> {

    void execute(SagaEventContext<TData, E> context) throws Exception;
}
