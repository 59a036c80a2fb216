package com.ivamare.saga;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the saga engine.
 *
 * <p>Example configuration:
 * <pre>
 * saga:
 *   enabled: true
 *   repository:
 *     store: jdbc
 *     table: saga.saga_instance
 * </pre>
 */
@ConfigurationProperties(prefix = "saga")
public class SagaProperties {

    /**
     * Enable/disable saga auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Instance persistence configuration.
     */
    private RepositoryProperties repository = new RepositoryProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public RepositoryProperties getRepository() {
        return repository;
    }

    public void setRepository(RepositoryProperties repository) {
        this.repository = repository;
    }

    /**
     * Backing store for saga instances.
     */
    public enum Store {
        /** PostgreSQL table accessed through {@code JdbcTemplate} */
        JDBC,

        /** Process-local map, for tests and single-node development */
        MEMORY
    }

    /**
     * Repository configuration.
     */
    public static class RepositoryProperties {

        /**
         * Backing store.
         */
        private Store store = Store.JDBC;

        /**
         * Schema-qualified table name used by the JDBC store.
         */
        private String table = "saga.saga_instance";

        public Store getStore() {
            return store;
        }

        public void setStore(Store store) {
            this.store = store;
        }

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }
    }
}
