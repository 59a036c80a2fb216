package com.ivamare.saga.statemachine;

import com.ivamare.saga.message.MessageContext;
import com.ivamare.saga.model.SagaInstance;

import java.util.Objects;

/**
 * Immutable description of how a saga reacts to one event type.
 *
 * <p>A handler consists of an optional guard, an optional action, an optional target state
 * and a finalize flag. Handlers are created with {@link #builder(String, Class)} or
 * {@link SagaDefinition.Builder#when(String, Class)} and registered on a
 * {@link SagaDefinition}.
 *
 * @param <TData> Saga data type
 */
public final class SagaEventHandler<TData> {

    private final String eventType;
    private final Class<?> payloadType;
    private final SagaGuard<TData, Object> guard;
    private final SagaAction<TData, Object> action;
    private final String targetState;
    private final boolean finalizing;

    private SagaEventHandler(Builder<TData, ?> builder) {
        this.eventType = builder.eventType;
        this.payloadType = builder.payloadType;
        this.guard = builder.guard;
        this.action = builder.action;
        this.targetState = builder.targetState;
        this.finalizing = builder.finalizing;
    }

    /**
     * Start building a handler for the given event type.
     *
     * @param eventType Event type tag
     * @param payloadType Expected payload class; the payload is cast to it before guard and action
     */
    public static <TData, E> Builder<TData, E> builder(String eventType, Class<E> payloadType) {
        return new Builder<>(eventType, payloadType);
    }

    public String eventType() {
        return eventType;
    }

    public Class<?> payloadType() {
        return payloadType;
    }

    /**
     * Target state, or null if the handler does not change state.
     */
    public String targetState() {
        return targetState;
    }

    public boolean isFinalizing() {
        return finalizing;
    }

    public boolean hasGuard() {
        return guard != null;
    }

    public boolean hasAction() {
        return action != null;
    }

    /**
     * Evaluate the guard. Handlers without a guard always apply.
     */
    boolean appliesTo(SagaInstance<TData> instance, Object event) {
        return guard == null || guard.test(instance, cast(event));
    }

    /**
     * Run the action, if any.
     */
    void runAction(SagaInstance<TData> instance, Object event, MessageContext context) throws Exception {
        if (action != null) {
            action.execute(new SagaEventContext<>(instance, cast(event), context));
        }
    }

    private Object cast(Object event) {
        if (event != null && !payloadType.isInstance(event)) {
            throw new IllegalArgumentException("Handler for " + eventType + " expects "
                + payloadType.getName() + " but received " + event.getClass().getName());
        }
        return event;
    }

    @Override
    public String toString() {
        return "SagaEventHandler{eventType=" + eventType
            + ", targetState=" + targetState
            + ", finalizing=" + finalizing + "}";
    }

    /**
     * Builder for {@link SagaEventHandler}.
     *
     * @param <TData> Saga data type
     * @param <E> Event payload type
     */
    public static final class Builder<TData, E> {

        private final String eventType;
        private final Class<E> payloadType;
        private SagaGuard<TData, Object> guard;
        private SagaAction<TData, Object> action;
        private String targetState;
        private boolean finalizing;

        private Builder(String eventType, Class<E> payloadType) {
            this.eventType = Objects.requireNonNull(eventType, "eventType");
            this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
        }

        /**
         * Move the instance to the given state after the action runs.
         */
        public Builder<TData, E> transitionTo(String stateName) {
            this.targetState = Objects.requireNonNull(stateName, "stateName");
            return this;
        }

        /**
         * Only run this handler when the guard holds. Repeated calls combine with AND.
         */
        @SuppressWarnings("unchecked")
        public Builder<TData, E> onlyIf(SagaGuard<TData, E> condition) {
            Objects.requireNonNull(condition, "condition");
            SagaGuard<TData, Object> next = (instance, event) -> condition.test(instance, (E) event);
            SagaGuard<TData, Object> previous = this.guard;
            this.guard = previous == null ? next
                : (instance, event) -> previous.test(instance, event) && next.test(instance, event);
            return this;
        }

        /**
         * Add an action. Repeated calls run in the order they were added.
         */
        @SuppressWarnings("unchecked")
        public Builder<TData, E> then(SagaAction<TData, E> step) {
            Objects.requireNonNull(step, "step");
            SagaAction<TData, Object> next = ctx -> step.execute((SagaEventContext<TData, E>) (SagaEventContext<?, ?>) ctx);
            SagaAction<TData, Object> previous = this.action;
            this.action = previous == null ? next
                : ctx -> {
                    previous.execute(ctx);
                    next.execute(ctx);
                };
            return this;
        }

        /**
         * Mark the saga completed once this handler has run.
         */
        public Builder<TData, E> finalizeSaga() {
            this.finalizing = true;
            return this;
        }

        public SagaEventHandler<TData> build() {
            return new SagaEventHandler<>(this);
        }
    }
}
