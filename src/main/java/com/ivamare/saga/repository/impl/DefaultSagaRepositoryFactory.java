package com.ivamare.saga.repository.impl;

import com.ivamare.saga.SagaProperties;
import com.ivamare.saga.repository.SagaInstanceCodec;
import com.ivamare.saga.repository.SagaRepository;
import com.ivamare.saga.repository.SagaRepositoryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Creates JDBC or in-memory repositories depending on the configured store.
 */
public class DefaultSagaRepositoryFactory implements SagaRepositoryFactory {

    private static final Logger log = LoggerFactory.getLogger(DefaultSagaRepositoryFactory.class);

    private final SagaProperties.Store store;
    private final JdbcTemplate jdbcTemplate;
    private final SagaInstanceCodec codec;
    private final String table;

    /**
     * @param store Backing store
     * @param jdbcTemplate JDBC access, required for {@link SagaProperties.Store#JDBC}
     * @param codec Instance codec
     * @param table Table name for the JDBC store
     */
    public DefaultSagaRepositoryFactory(SagaProperties.Store store, JdbcTemplate jdbcTemplate,
                                        SagaInstanceCodec codec, String table) {
        if (store == SagaProperties.Store.JDBC && jdbcTemplate == null) {
            throw new IllegalStateException("saga.repository.store=jdbc requires a JdbcTemplate");
        }
        this.store = store;
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.table = table;
    }

    @Override
    public <TData> SagaRepository<TData> create(String sagaType, Class<TData> dataType) {
        log.info("Creating {} saga repository for {}", store, sagaType);
        return switch (store) {
            case JDBC -> new JdbcSagaRepository<>(jdbcTemplate, codec, sagaType, dataType, table);
            case MEMORY -> new InMemorySagaRepository<>(sagaType, dataType, codec);
        };
    }

    public SagaProperties.Store getStore() {
        return store;
    }
}
