package com.ivamare.saga.statemachine;

import java.util.UUID;

/**
 * Obtains the correlation id from an event payload.
 *
 * <p>Registered per event type on the saga definition. Implementations may throw
 * {@link com.ivamare.saga.exception.CorrelationExtractionException}; returning null is
 * treated the same way.
 */
@FunctionalInterface
public interface CorrelationIdExtractor {

    UUID extract(Object payload);
}
