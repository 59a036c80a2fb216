package com.ivamare.saga.message;

import java.util.Optional;

/**
 * Request-scoped service lookup exposed to saga handlers.
 */
public interface ServiceResolver {

    /**
     * Resolve a service by type.
     *
     * @param type Service type
     * @return the service, or empty if none is available
     */
    <T> Optional<T> resolve(Class<T> type);

    /**
     * Resolve a service by type, failing if none is available.
     *
     * @throws IllegalStateException if the service cannot be resolved
     */
    default <T> T require(Class<T> type) {
        return resolve(type).orElseThrow(() ->
            new IllegalStateException("No service available for " + type.getName()));
    }

    /**
     * Resolver that never finds anything.
     */
    static ServiceResolver none() {
        return new ServiceResolver() {
            @Override
            public <T> Optional<T> resolve(Class<T> type) {
                return Optional.empty();
            }
        };
    }
}
