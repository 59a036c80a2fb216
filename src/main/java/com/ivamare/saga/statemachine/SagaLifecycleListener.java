package com.ivamare.saga.statemachine;

import com.ivamare.saga.model.SagaInstance;

/**
 * Callbacks invoked by the state machine when an instance completes or faults.
 *
 * <p>Listeners observe; exceptions they throw are logged and do not affect dispatch.
 */
public interface SagaLifecycleListener<TData> {

    default void onCompleted(SagaInstance<TData> instance) {
    }

    default void onFaulted(SagaInstance<TData> instance, Exception error) {
    }
}
