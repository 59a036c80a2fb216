package com.ivamare.saga.statemachine;

import com.ivamare.saga.support.OrderSaga;
import com.ivamare.saga.support.OrderSagaData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.ivamare.saga.support.OrderEvents.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SagaDefinition")
class SagaDefinitionTest {

    @Nested
    @DisplayName("states")
    class States {

        @Test
        @DisplayName("should include initial, declared and target states")
        void shouldIncludeInitialDeclaredAndTargetStates() {
            SagaDefinition<OrderSagaData> definition = OrderSaga.definition();

            assertEquals(SagaDefinition.DEFAULT_INITIAL_STATE, definition.getInitialState());
            assertTrue(definition.getStates().containsAll(List.of(
                "Initial", OrderSaga.AWAITING_PAYMENT, OrderSaga.AWAITING_SHIPMENT, OrderSaga.SHIPPED)));
            assertEquals(1, definition.getTerminalStates().size());
            assertTrue(definition.isTerminal(OrderSaga.SHIPPED));
            assertFalse(definition.isTerminal(OrderSaga.AWAITING_PAYMENT));
        }

        @Test
        @DisplayName("should declare state idempotently")
        void shouldDeclareStateIdempotently() {
            SagaDefinition<String> definition = SagaDefinition.builder("S", () -> "")
                .declareState("A")
                .declareState("A")
                .build();

            assertEquals(2, definition.getStates().size());
        }

        @Test
        @DisplayName("should support a custom initial state name")
        void shouldSupportCustomInitialStateName() {
            SagaDefinition.Builder<String> b = SagaDefinition.builder("S", () -> "");
            b.initialState("New");
            b.initially(b.when("Start", Object.class).transitionTo("Running").build());
            SagaDefinition<String> definition = b.build();

            assertEquals("New", definition.getInitialState());
            assertEquals(1, definition.handlersFor("New", "Start").size());
        }

        @Test
        @DisplayName("should treat completeWhenEnter as terminal marking")
        void shouldTreatCompleteWhenEnterAsTerminalMarking() {
            SagaDefinition<String> definition = SagaDefinition.builder("S", () -> "")
                .completeWhenEnter("Done")
                .build();

            assertTrue(definition.isTerminal("Done"));
        }
    }

    @Nested
    @DisplayName("handlers")
    class Handlers {

        @Test
        @DisplayName("should look up initial handlers for the initial state")
        void shouldLookUpInitialHandlersForInitialState() {
            SagaDefinition<OrderSagaData> definition = OrderSaga.definition();

            assertEquals(1, definition.handlersFor("Initial", ORDER_CREATED).size());
            assertTrue(definition.handlersFor("Initial", PAYMENT_COMPLETED).isEmpty());
        }

        @Test
        @DisplayName("should look up state handlers by state and event type")
        void shouldLookUpStateHandlersByStateAndEventType() {
            SagaDefinition<OrderSagaData> definition = OrderSaga.definition();

            List<SagaEventHandler<OrderSagaData>> handlers =
                definition.handlersFor(OrderSaga.AWAITING_PAYMENT, PAYMENT_COMPLETED);

            assertEquals(1, handlers.size());
            assertEquals(OrderSaga.AWAITING_SHIPMENT, handlers.get(0).targetState());
            assertTrue(definition.handlersFor(OrderSaga.AWAITING_SHIPMENT, PAYMENT_COMPLETED).isEmpty());
            assertTrue(definition.handlersFor("Unknown", PAYMENT_COMPLETED).isEmpty());
        }

        @Test
        @DisplayName("should keep registration order for handlers of the same key")
        void shouldKeepRegistrationOrder() {
            SagaDefinition.Builder<String> b = SagaDefinition.builder("S", () -> "");
            SagaEventHandler<String> first = b.when("E", Object.class).transitionTo("A").build();
            SagaEventHandler<String> second = b.when("E", Object.class).transitionTo("B").build();
            b.during("X", first, second);

            SagaDefinition<String> definition = b.build();

            assertEquals(List.of(first, second), definition.handlersFor("X", "E"));
        }

        @Test
        @DisplayName("should report which events start or are handled by the saga")
        void shouldReportStartAndHandledEvents() {
            SagaDefinition<OrderSagaData> definition = OrderSaga.definition();

            assertTrue(definition.canStartSaga(ORDER_CREATED));
            assertFalse(definition.canStartSaga(PAYMENT_COMPLETED));
            assertTrue(definition.handlesEvent(ORDER_CREATED));
            assertTrue(definition.handlesEvent(ORDER_SHIPPED));
            assertFalse(definition.handlesEvent("InventoryReserved"));
        }

        @Test
        @DisplayName("should reject state handlers for the initial state")
        void shouldRejectStateHandlersForInitialState() {
            SagaDefinition.Builder<String> b = SagaDefinition.builder("S", () -> "");
            SagaEventHandler<String> handler = b.when("E", Object.class).build();

            assertThrows(IllegalArgumentException.class, () -> b.declareStateHandler("Initial", handler));
        }

        @Test
        @DisplayName("should reject handlers declared before renaming the initial state onto their state")
        void shouldRejectMisplacedHandlersOnBuild() {
            SagaDefinition.Builder<String> b = SagaDefinition.builder("S", () -> "");
            b.during("Start", b.when("E", Object.class).build());
            b.initialState("Start");

            assertThrows(IllegalStateException.class, b::build);
        }

        @Test
        @DisplayName("should reject terminal initial state")
        void shouldRejectTerminalInitialState() {
            SagaDefinition.Builder<String> b = SagaDefinition.builder("S", () -> "").markTerminal("Initial");

            assertThrows(IllegalStateException.class, b::build);
        }

        @Test
        @DisplayName("should not be affected by builder changes after build")
        void shouldNotBeAffectedByBuilderChangesAfterBuild() {
            SagaDefinition.Builder<String> b = SagaDefinition.builder("S", () -> "");
            b.during("A", b.when("E", Object.class).build());
            SagaDefinition<String> definition = b.build();

            b.during("A", b.when("E", Object.class).build());
            b.markTerminal("Z");

            assertEquals(1, definition.handlersFor("A", "E").size());
            assertFalse(definition.isTerminal("Z"));
            assertThrows(UnsupportedOperationException.class,
                () -> definition.handlersFor("A", "E").add(null));
        }
    }

    @Test
    @DisplayName("should create fresh data from the factory")
    void shouldCreateFreshDataFromFactory() {
        SagaDefinition<OrderSagaData> definition = OrderSaga.definition();

        assertNotSame(definition.newData(), definition.newData());
    }

    @Test
    @DisplayName("should register typed correlation extractor")
    void shouldRegisterTypedCorrelationExtractor() {
        UUID id = UUID.randomUUID();
        SagaDefinition<String> definition = SagaDefinition.builder("S", () -> "")
            .correlate("Legacy", Map.class, map -> UUID.fromString((String) map.get("orderRef")))
            .build();

        CorrelationIdExtractor extractor = definition.correlationExtractor("Legacy").orElseThrow();

        assertEquals(id, extractor.extract(Map.of("orderRef", id.toString())));
        assertTrue(definition.correlationExtractor("Other").isEmpty());
    }
}
