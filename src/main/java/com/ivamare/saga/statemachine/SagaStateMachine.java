package com.ivamare.saga.statemachine;

import com.ivamare.saga.exception.CorrelationExtractionException;
import com.ivamare.saga.message.MessageContext;
import com.ivamare.saga.model.SagaInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Dispatches events to the handlers of a {@link SagaDefinition}, applying transitions,
 * completion and fault bookkeeping to the instance passed in.
 *
 * <p>Holds no per-instance state: all mutable state lives in the {@link SagaInstance}, so one
 * state machine can serve concurrent calls for different instances.
 *
 * <p>Dispatch rules for one event:
 * <ol>
 *   <li>Completed or faulted instances are left untouched and the event is reported unhandled.</li>
 *   <li>Handlers are looked up by (current state, event type); the initial state uses the
 *       initial handlers. No handlers means unhandled, which is not an error.</li>
 *   <li>Every handler whose guard passes runs in registration order: action, then transition to
 *       its target state, then completion if it finalizes.</li>
 *   <li>Entering a terminal state completes the instance. Once completed, the remaining
 *       handlers are skipped.</li>
 *   <li>An exception from a guard or action faults the instance and is re-thrown unchanged.</li>
 * </ol>
 *
 * @param <TData> Saga data type
 */
public class SagaStateMachine<TData> {

    private static final Logger log = LoggerFactory.getLogger(SagaStateMachine.class);

    private final SagaDefinition<TData> definition;

    public SagaStateMachine(SagaDefinition<TData> definition) {
        this.definition = Objects.requireNonNull(definition, "definition");
    }

    public SagaDefinition<TData> getDefinition() {
        return definition;
    }

    public String getSagaType() {
        return definition.getSagaType();
    }

    public String getInitialState() {
        return definition.getInitialState();
    }

    /**
     * Create a fresh data payload for a new instance.
     */
    public TData newData() {
        return definition.newData();
    }

    /**
     * Whether the event type can start a new instance.
     */
    public boolean canStartSaga(String eventType) {
        return definition.canStartSaga(eventType);
    }

    /**
     * Whether any handler, initial or per-state, exists for the event type.
     */
    public boolean handlesEvent(String eventType) {
        return definition.handlesEvent(eventType);
    }

    /**
     * Extract the correlation id of the message's payload.
     *
     * @throws CorrelationExtractionException if no correlation id can be obtained
     */
    public UUID extractCorrelationId(MessageContext context) {
        return extractCorrelationId(context.eventType(), context.payload());
    }

    /**
     * Extract the correlation id of an event payload, using the extractor registered for the
     * event type, or the default strategy when none is registered.
     *
     * @throws CorrelationExtractionException if no correlation id can be obtained
     */
    public UUID extractCorrelationId(String eventType, Object payload) {
        CorrelationIdExtractor extractor = definition.correlationExtractor(eventType).orElse(null);
        if (extractor == null) {
            return DefaultCorrelationIdExtractor.extract(eventType, payload);
        }

        UUID id;
        try {
            id = extractor.extract(payload);
        } catch (CorrelationExtractionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CorrelationExtractionException(eventType, e.getMessage(), e);
        }
        if (id == null) {
            throw new CorrelationExtractionException(eventType, "extractor returned null");
        }
        return id;
    }

    /**
     * Process the message's payload against the instance.
     *
     * @see #processEvent(SagaInstance, String, Object, MessageContext)
     */
    public boolean processEvent(SagaInstance<TData> instance, MessageContext context) throws Exception {
        return processEvent(instance, context.eventType(), context.payload(), context);
    }

    /**
     * Process an event against an instance.
     *
     * @return true if at least one handler was registered for the instance's state and the event
     *         type; false if none was, or the instance is already completed or faulted
     * @throws CancellationException if cancellation was requested before a handler ran
     * @throws Exception the exception raised by a guard or action, after the instance was faulted
     */
    public boolean processEvent(SagaInstance<TData> instance, String eventType, Object event,
                                MessageContext context) throws Exception {
        if (!instance.isActive()) {
            log.debug("Ignoring event {} for saga {} {}: instance is {}", eventType,
                getSagaType(), instance.getCorrelationId(), instance.isFaulted() ? "faulted" : "completed");
            return false;
        }

        List<SagaEventHandler<TData>> handlers = definition.handlersFor(instance.getCurrentState(), eventType);
        if (handlers.isEmpty()) {
            log.warn("No handler found for event {} in state {} for saga {} {}",
                eventType, instance.getCurrentState(), getSagaType(), instance.getCorrelationId());
            return false;
        }

        for (SagaEventHandler<TData> handler : handlers) {
            if (context.isCancelled()) {
                throw new CancellationException("Processing of " + eventType + " for saga "
                    + instance.getCorrelationId() + " was cancelled");
            }

            try {
                if (!handler.appliesTo(instance, event)) {
                    log.debug("Guard rejected handler {} for saga {}", handler, instance.getCorrelationId());
                    continue;
                }
                handler.runAction(instance, event, context);
            } catch (CancellationException e) {
                throw e;
            } catch (Exception e) {
                log.error("Error processing event {} for saga {} {} in state {}", eventType,
                    getSagaType(), instance.getCorrelationId(), instance.getCurrentState(), e);
                fault(instance, e);
                throw e;
            }

            if (instance.isCompleted()) {
                if (handler.targetState() != null) {
                    log.debug("Skipping transition to {} for completed saga {} {}",
                        handler.targetState(), getSagaType(), instance.getCorrelationId());
                }
                continue;
            }
            if (handler.targetState() != null) {
                instance.transitionTo(handler.targetState(), "Event: " + eventType);
            }
            if (handler.isFinalizing() || definition.isTerminal(instance.getCurrentState())) {
                complete(instance);
            }

            log.debug("Processed event {} for saga {}, new state: {}",
                eventType, instance.getCorrelationId(), instance.getCurrentState());
        }

        return true;
    }

    /**
     * Mark the instance faulted, unless it already is, and notify listeners.
     * Completed instances are left as they are.
     */
    public void fault(SagaInstance<TData> instance, Exception error) {
        if (instance.isCompleted()) {
            return;
        }
        boolean first = !instance.isFaulted();
        instance.fault(error);
        if (!first) {
            return;
        }
        for (SagaLifecycleListener<TData> listener : definition.getListeners()) {
            try {
                listener.onFaulted(instance, error);
            } catch (RuntimeException e) {
                log.error("Fault listener failed for saga {}", instance.getCorrelationId(), e);
            }
        }
    }

    private void complete(SagaInstance<TData> instance) {
        if (instance.isCompleted()) {
            return;
        }
        instance.complete();
        log.info("Saga {} {} completed in state {}", getSagaType(),
            instance.getCorrelationId(), instance.getCurrentState());
        for (SagaLifecycleListener<TData> listener : definition.getListeners()) {
            try {
                listener.onCompleted(instance);
            } catch (RuntimeException e) {
                log.error("Completion listener failed for saga {}", instance.getCorrelationId(), e);
            }
        }
    }
}
