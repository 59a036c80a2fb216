package com.ivamare.saga.statemachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Declarative registry of a saga's states, event handlers and terminal states.
 *
 * <p>Built once through {@link Builder} and read-only afterwards, so a single definition can be
 * shared by any number of concurrent message processors.
 *
 * <p>Handlers are keyed by (state, event type). Handlers registered with
 * {@link Builder#declareInitialHandler} are used while an instance is in the initial state and
 * are the only ones that may start a new instance. Several handlers for the same key all run,
 * in registration order.
 *
 * <p>Example:
 * <pre>{@code
 * SagaDefinition.Builder<OrderData> b = SagaDefinition.builder("OrderSaga", OrderData::new);
 * b.initially(b.when("OrderCreated", OrderCreated.class)
 *     .transitionTo("AwaitingPayment")
 *     .then(ctx -> ctx.publish("ProcessPayment", ...))
 *     .build());
 * b.during("AwaitingPayment",
 *     b.when("PaymentCompleted", PaymentCompleted.class).transitionTo("AwaitingShipment").build(),
 *     b.when("PaymentFailed", PaymentFailed.class).finalizeSaga().build());
 * b.during("AwaitingShipment",
 *     b.when("OrderShipped", OrderShipped.class).transitionTo("Shipped").finalizeSaga().build());
 * b.markTerminal("Shipped");
 * SagaDefinition<OrderData> definition = b.build();
 * }</pre>
 *
 * @param <TData> Saga data type
 */
public final class SagaDefinition<TData> {

    public static final String DEFAULT_INITIAL_STATE = "Initial";

    private final String sagaType;
    private final String initialState;
    private final Supplier<TData> dataFactory;
    private final Set<String> states;
    private final Map<String, List<SagaEventHandler<TData>>> initialHandlers;
    private final Map<String, Map<String, List<SagaEventHandler<TData>>>> stateHandlers;
    private final Set<String> terminalStates;
    private final Map<String, CorrelationIdExtractor> correlationExtractors;
    private final List<SagaLifecycleListener<TData>> listeners;

    private SagaDefinition(Builder<TData> builder) {
        this.sagaType = builder.sagaType;
        this.initialState = builder.initialState;
        this.dataFactory = builder.dataFactory;
        Set<String> allStates = new LinkedHashSet<>();
        allStates.add(builder.initialState);
        allStates.addAll(builder.states);
        this.states = Collections.unmodifiableSet(allStates);
        this.initialHandlers = freeze(builder.initialHandlers);
        Map<String, Map<String, List<SagaEventHandler<TData>>>> byState = new LinkedHashMap<>();
        builder.stateHandlers.forEach((state, handlers) -> byState.put(state, freeze(handlers)));
        this.stateHandlers = Collections.unmodifiableMap(byState);
        this.terminalStates = Collections.unmodifiableSet(new LinkedHashSet<>(builder.terminalStates));
        this.correlationExtractors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.correlationExtractors));
        this.listeners = List.copyOf(builder.listeners);
    }

    public static <TData> Builder<TData> builder(String sagaType, Supplier<TData> dataFactory) {
        return new Builder<>(sagaType, dataFactory);
    }

    public String getSagaType() {
        return sagaType;
    }

    public String getInitialState() {
        return initialState;
    }

    /**
     * Create a fresh data payload for a new instance.
     */
    public TData newData() {
        return dataFactory.get();
    }

    public Set<String> getStates() {
        return states;
    }

    public Set<String> getTerminalStates() {
        return terminalStates;
    }

    public boolean isTerminal(String stateName) {
        return terminalStates.contains(stateName);
    }

    /**
     * Handlers applicable to an instance in {@code currentState} receiving {@code eventType}.
     *
     * @return handlers in registration order, empty if none
     */
    public List<SagaEventHandler<TData>> handlersFor(String currentState, String eventType) {
        if (initialState.equals(currentState)) {
            return initialHandlers.getOrDefault(eventType, List.of());
        }
        Map<String, List<SagaEventHandler<TData>>> forState = stateHandlers.get(currentState);
        if (forState == null) {
            return List.of();
        }
        return forState.getOrDefault(eventType, List.of());
    }

    /**
     * Whether an initial handler exists for the event type.
     */
    public boolean canStartSaga(String eventType) {
        return initialHandlers.containsKey(eventType);
    }

    /**
     * Whether any initial or state handler exists for the event type.
     */
    public boolean handlesEvent(String eventType) {
        if (canStartSaga(eventType)) {
            return true;
        }
        return stateHandlers.values().stream().anyMatch(handlers -> handlers.containsKey(eventType));
    }

    public Optional<CorrelationIdExtractor> correlationExtractor(String eventType) {
        return Optional.ofNullable(correlationExtractors.get(eventType));
    }

    public List<SagaLifecycleListener<TData>> getListeners() {
        return listeners;
    }

    private static <TData> Map<String, List<SagaEventHandler<TData>>> freeze(
            Map<String, List<SagaEventHandler<TData>>> handlers) {
        Map<String, List<SagaEventHandler<TData>>> copy = new LinkedHashMap<>();
        handlers.forEach((eventType, list) -> copy.put(eventType, List.copyOf(list)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Builder for {@link SagaDefinition}. Not thread-safe.
     *
     * @param <TData> Saga data type
     */
    public static final class Builder<TData> {

        private final String sagaType;
        private final Supplier<TData> dataFactory;
        private String initialState = DEFAULT_INITIAL_STATE;
        private final Set<String> states = new LinkedHashSet<>();
        private final Map<String, List<SagaEventHandler<TData>>> initialHandlers = new LinkedHashMap<>();
        private final Map<String, Map<String, List<SagaEventHandler<TData>>>> stateHandlers = new LinkedHashMap<>();
        private final Set<String> terminalStates = new LinkedHashSet<>();
        private final Map<String, CorrelationIdExtractor> correlationExtractors = new LinkedHashMap<>();
        private final List<SagaLifecycleListener<TData>> listeners = new ArrayList<>();

        private Builder(String sagaType, Supplier<TData> dataFactory) {
            this.sagaType = Objects.requireNonNull(sagaType, "sagaType");
            this.dataFactory = Objects.requireNonNull(dataFactory, "dataFactory");
        }

        /**
         * Rename the initial state (default {@value SagaDefinition#DEFAULT_INITIAL_STATE}).
         */
        public Builder<TData> initialState(String stateName) {
            this.initialState = Objects.requireNonNull(stateName, "stateName");
            return this;
        }

        /**
         * Register a state. Idempotent.
         */
        public Builder<TData> declareState(String stateName) {
            Objects.requireNonNull(stateName, "stateName");
            if (states.add(stateName)) {
                stateHandlers.put(stateName, new LinkedHashMap<>());
            }
            return this;
        }

        /**
         * Register a handler usable to start a new instance.
         */
        public Builder<TData> declareInitialHandler(SagaEventHandler<TData> handler) {
            Objects.requireNonNull(handler, "handler");
            declareTarget(handler);
            initialHandlers.computeIfAbsent(handler.eventType(), k -> new ArrayList<>()).add(handler);
            return this;
        }

        /**
         * Register a handler usable while an instance is in {@code stateName}.
         *
         * @throws IllegalArgumentException if {@code stateName} is the initial state
         */
        public Builder<TData> declareStateHandler(String stateName, SagaEventHandler<TData> handler) {
            Objects.requireNonNull(handler, "handler");
            if (initialState.equals(stateName)) {
                throw new IllegalArgumentException("Handlers for the initial state " + stateName
                    + " must be declared with declareInitialHandler");
            }
            declareState(stateName);
            declareTarget(handler);
            stateHandlers.get(stateName)
                .computeIfAbsent(handler.eventType(), k -> new ArrayList<>())
                .add(handler);
            return this;
        }

        /**
         * Mark a state as a completion state: entering it completes the instance.
         */
        public Builder<TData> markTerminal(String stateName) {
            declareState(stateName);
            terminalStates.add(stateName);
            return this;
        }

        /**
         * Alias of {@link #markTerminal(String)}.
         */
        public Builder<TData> completeWhenEnter(String stateName) {
            return markTerminal(stateName);
        }

        @SafeVarargs
        public final Builder<TData> initially(SagaEventHandler<TData>... handlers) {
            for (SagaEventHandler<TData> handler : handlers) {
                declareInitialHandler(handler);
            }
            return this;
        }

        @SafeVarargs
        public final Builder<TData> during(String stateName, SagaEventHandler<TData>... handlers) {
            declareState(stateName);
            for (SagaEventHandler<TData> handler : handlers) {
                declareStateHandler(stateName, handler);
            }
            return this;
        }

        /**
         * Start a handler builder bound to this saga's data type.
         */
        public <E> SagaEventHandler.Builder<TData, E> when(String eventType, Class<E> payloadType) {
            return SagaEventHandler.builder(eventType, payloadType);
        }

        /**
         * Register the correlation id extractor for an event type.
         */
        public Builder<TData> correlate(String eventType, CorrelationIdExtractor extractor) {
            correlationExtractors.put(
                Objects.requireNonNull(eventType, "eventType"),
                Objects.requireNonNull(extractor, "extractor"));
            return this;
        }

        /**
         * Register a typed correlation id extractor for an event type.
         */
        public <E> Builder<TData> correlate(String eventType, Class<E> payloadType,
                                            Function<E, UUID> extractor) {
            Objects.requireNonNull(extractor, "extractor");
            return correlate(eventType, payload -> extractor.apply(payloadType.cast(payload)));
        }

        public Builder<TData> listener(SagaLifecycleListener<TData> listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * Build the immutable definition.
         *
         * @throws IllegalStateException if the initial state is marked terminal
         *         or has handlers declared as a regular state
         */
        public SagaDefinition<TData> build() {
            if (terminalStates.contains(initialState)) {
                throw new IllegalStateException("Initial state " + initialState + " cannot be terminal");
            }
            Map<String, List<SagaEventHandler<TData>>> misplaced = stateHandlers.get(initialState);
            if (misplaced != null && !misplaced.isEmpty()) {
                throw new IllegalStateException("Handlers for the initial state " + initialState
                    + " must be declared with declareInitialHandler");
            }
            states.remove(initialState);
            stateHandlers.remove(initialState);
            return new SagaDefinition<>(this);
        }

        private void declareTarget(SagaEventHandler<TData> handler) {
            if (handler.targetState() != null) {
                declareState(handler.targetState());
            }
        }
    }
}
