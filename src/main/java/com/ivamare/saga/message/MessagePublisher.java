package com.ivamare.saga.message;

/**
 * Port for publishing follow-up messages from saga handlers.
 *
 * <p>Implemented by the transport integration.
 */
@FunctionalInterface
public interface MessagePublisher {

    /**
     * Publish a message.
     *
     * @param messageType Type tag of the message (e.g., "ProcessPayment")
     * @param message The message payload
     */
    void publish(String messageType, Object message);

    /**
     * Publisher that rejects every message. Used when the transport does not support publishing.
     */
    static MessagePublisher unsupported() {
        return (messageType, message) -> {
            throw new UnsupportedOperationException(
                "Publishing is not available in this message context (type " + messageType + ")");
        };
    }
}
