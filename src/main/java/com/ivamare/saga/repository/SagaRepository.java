package com.ivamare.saga.repository;

import com.ivamare.saga.model.SagaInstance;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for saga instances of one saga type.
 *
 * <p>Saves are optimistic: {@link #save} succeeds only if the stored instance has not been
 * written since the caller read it, and throws
 * {@link com.ivamare.saga.exception.SagaConcurrencyException} otherwise.
 *
 * @param <TData> Saga data type
 */
public interface SagaRepository<TData> {

    /**
     * Find an instance by correlation id.
     */
    Optional<SagaInstance<TData>> find(UUID correlationId);

    /**
     * Create and store a new instance.
     *
     * @throws com.ivamare.saga.exception.DuplicateSagaException if the correlation id exists
     */
    SagaInstance<TData> create(UUID correlationId, String initialState, TData data);

    /**
     * Store the current state of an instance.
     *
     * @throws com.ivamare.saga.exception.SagaConcurrencyException if the stored instance changed
     *         since it was read
     */
    void save(SagaInstance<TData> instance);

    /**
     * Remove an instance.
     *
     * @return true if an instance was removed
     */
    boolean delete(UUID correlationId);

    /**
     * Find instances currently in the given state.
     */
    List<SagaInstance<TData>> findByState(String state);

    /**
     * Find active instances not updated for at least {@code inactiveFor}.
     */
    List<SagaInstance<TData>> findTimedOut(Duration inactiveFor);

    /**
     * Find faulted instances.
     */
    List<SagaInstance<TData>> findFaulted();

    /**
     * Remove completed and faulted instances not updated for at least {@code olderThan}.
     *
     * @return number of instances removed
     */
    int cleanup(Duration olderThan);
}
