package com.ivamare.saga.repository;

/**
 * Creates repositories for saga types, backed by the configured store.
 */
public interface SagaRepositoryFactory {

    /**
     * Create a repository for one saga type.
     *
     * @param sagaType Saga type name; instances of different types never collide
     * @param dataType Saga data class, used for deserialization
     */
    <TData> SagaRepository<TData> create(String sagaType, Class<TData> dataType);
}
