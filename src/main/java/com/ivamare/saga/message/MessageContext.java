package com.ivamare.saga.message;

import java.util.Map;

/**
 * Inbound message as seen by the saga engine.
 *
 * <p>Exposes the decoded payload together with its event type tag, a way to publish
 * follow-up messages, and a request-scoped service resolver.
 */
public interface MessageContext {

    /**
     * Event type tag used for handler dispatch (e.g., "OrderCreated").
     */
    String eventType();

    /**
     * The decoded event payload.
     */
    Object payload();

    /**
     * Transport headers (never null).
     */
    Map<String, Object> headers();

    /**
     * Publish a follow-up message.
     */
    void publish(String messageType, Object message);

    /**
     * Request-scoped service resolver.
     */
    ServiceResolver services();

    /**
     * Whether the caller has requested cancellation of this message's processing.
     */
    boolean isCancelled();

    /**
     * The payload cast to the expected type.
     *
     * @throws ClassCastException if the payload is not of the requested type
     */
    default <T> T payloadAs(Class<T> type) {
        return type.cast(payload());
    }
}
