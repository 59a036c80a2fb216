package com.ivamare.saga.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Saga exceptions")
class SagaExceptionTest {

    @Test
    @DisplayName("all exceptions should extend SagaException")
    void allExceptionsShouldExtendSagaException() {
        UUID id = UUID.randomUUID();

        assertInstanceOf(SagaException.class, new CorrelationExtractionException("E", "msg"));
        assertInstanceOf(SagaException.class, new DuplicateSagaException("S", id));
        assertInstanceOf(SagaException.class, new SagaConcurrencyException(id, 3));
        assertInstanceOf(SagaException.class, new InvalidSagaOperationException("msg"));
        assertInstanceOf(RuntimeException.class, new SagaException("msg"));
    }

    @Test
    @DisplayName("CorrelationExtractionException should carry event type and cause")
    void correlationExtractionExceptionShouldCarryEventType() {
        IllegalArgumentException cause = new IllegalArgumentException("bad uuid");
        CorrelationExtractionException e = new CorrelationExtractionException("PaymentCompleted", "no id", cause);

        assertEquals("PaymentCompleted", e.getEventType());
        assertSame(cause, e.getCause());
        assertTrue(e.getMessage().contains("PaymentCompleted"));
        assertTrue(e.getMessage().contains("no id"));
    }

    @Test
    @DisplayName("DuplicateSagaException should carry saga type and id")
    void duplicateSagaExceptionShouldCarrySagaTypeAndId() {
        UUID id = UUID.randomUUID();
        DuplicateSagaException e = new DuplicateSagaException("OrderSaga", id);

        assertEquals("OrderSaga", e.getSagaType());
        assertEquals(id, e.getCorrelationId());
        assertTrue(e.getMessage().contains(id.toString()));
    }

    @Test
    @DisplayName("SagaConcurrencyException should carry expected revision")
    void sagaConcurrencyExceptionShouldCarryExpectedRevision() {
        UUID id = UUID.randomUUID();
        SagaConcurrencyException e = new SagaConcurrencyException(id, 4);

        assertEquals(id, e.getCorrelationId());
        assertEquals(4, e.getExpectedRevision());
    }
}
