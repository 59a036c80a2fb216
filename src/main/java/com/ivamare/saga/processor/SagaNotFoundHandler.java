package com.ivamare.saga.processor;

import com.ivamare.saga.message.MessageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Invoked when an event correlates to no existing instance and cannot start one.
 *
 * <p>The message is considered handled: the processor returns normally after the callback.
 */
@FunctionalInterface
public interface SagaNotFoundHandler {

    void onSagaNotFound(String sagaType, UUID correlationId, MessageContext context);

    /**
     * Handler that logs the unroutable message and drops it.
     */
    static SagaNotFoundHandler logging() {
        Logger log = LoggerFactory.getLogger(SagaNotFoundHandler.class);
        return (sagaType, correlationId, context) ->
            log.warn("Event {} for unknown saga {} {} cannot start a new instance, discarding",
                context.eventType(), sagaType, correlationId);
    }
}
