package com.ivamare.saga.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Default immutable {@link MessageContext}.
 *
 * @param eventType Event type tag
 * @param payload Decoded payload
 * @param headers Transport headers
 * @param publisher Publisher for follow-up messages
 * @param services Request-scoped service resolver
 * @param cancellation Cancellation signal, polled by the processor and state machine
 */
public record DefaultMessageContext(
    String eventType,
    Object payload,
    Map<String, Object> headers,
    MessagePublisher publisher,
    ServiceResolver services,
    BooleanSupplier cancellation
) implements MessageContext {

    public DefaultMessageContext {
        Objects.requireNonNull(eventType, "eventType");
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
        publisher = publisher != null ? publisher : MessagePublisher.unsupported();
        services = services != null ? services : ServiceResolver.none();
        cancellation = cancellation != null ? cancellation : () -> false;
    }

    /**
     * Create a context with only an event type and payload.
     */
    public static DefaultMessageContext of(String eventType, Object payload) {
        return new DefaultMessageContext(eventType, payload, null, null, null, null);
    }

    public static Builder builder(String eventType, Object payload) {
        return new Builder(eventType, payload);
    }

    @Override
    public void publish(String messageType, Object message) {
        publisher.publish(messageType, message);
    }

    @Override
    public boolean isCancelled() {
        return cancellation.getAsBoolean();
    }

    /**
     * Builder for {@link DefaultMessageContext}.
     */
    public static final class Builder {

        private final String eventType;
        private final Object payload;
        private Map<String, Object> headers;
        private MessagePublisher publisher;
        private ServiceResolver services;
        private BooleanSupplier cancellation;

        private Builder(String eventType, Object payload) {
            this.eventType = eventType;
            this.payload = payload;
        }

        public Builder headers(Map<String, Object> headers) {
            this.headers = headers;
            return this;
        }

        public Builder publisher(MessagePublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder services(ServiceResolver services) {
            this.services = services;
            return this;
        }

        public Builder cancellation(BooleanSupplier cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public DefaultMessageContext build() {
            return new DefaultMessageContext(eventType, payload, headers, publisher, services, cancellation);
        }
    }
}
