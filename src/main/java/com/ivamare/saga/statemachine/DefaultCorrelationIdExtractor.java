package com.ivamare.saga.statemachine;

import com.ivamare.saga.exception.CorrelationExtractionException;
import com.ivamare.saga.message.CorrelatedMessage;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Fallback correlation strategy used when no extractor is registered for an event type.
 *
 * <p>Accepts payloads implementing {@link CorrelatedMessage}, and map payloads carrying one of
 * the keys in {@link #MAP_KEYS} (checked in order) whose value is a UUID or UUID string.
 */
final class DefaultCorrelationIdExtractor {

    static final List<String> MAP_KEYS = List.of(
        "correlationId", "correlation_id",
        "sagaId", "saga_id",
        "id"
    );

    private DefaultCorrelationIdExtractor() {
    }

    static UUID extract(String eventType, Object payload) {
        if (payload == null) {
            throw new CorrelationExtractionException(eventType, "payload is null");
        }
        if (payload instanceof CorrelatedMessage correlated) {
            UUID id = correlated.correlationId();
            if (id == null) {
                throw new CorrelationExtractionException(eventType, "correlationId() returned null");
            }
            return id;
        }
        if (payload instanceof Map<?, ?> map) {
            for (String key : MAP_KEYS) {
                Object value = map.get(key);
                UUID id = toUuid(value);
                if (id != null) {
                    return id;
                }
            }
            throw new CorrelationExtractionException(eventType,
                "no UUID value under any of " + MAP_KEYS);
        }
        throw new CorrelationExtractionException(eventType,
            payload.getClass().getSimpleName() + " does not implement CorrelatedMessage "
                + "and no extractor is registered");
    }

    private static UUID toUuid(Object value) {
        if (value instanceof UUID uuid) {
            return uuid;
        }
        if (value instanceof String str) {
            try {
                return UUID.fromString(str);
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
        return null;
    }
}
