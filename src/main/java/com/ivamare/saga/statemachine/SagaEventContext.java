package com.ivamare.saga.statemachine;

import com.ivamare.saga.message.MessageContext;
import com.ivamare.saga.message.ServiceResolver;
import com.ivamare.saga.model.SagaInstance;

import java.util.UUID;

/**
 * Context passed to saga actions.
 *
 * @param <TData> Saga data type
 * @param <E> Event payload type
 */
public class SagaEventContext<TData, E> {

    private final SagaInstance<TData> instance;
    private final E event;
    private final MessageContext messageContext;

    public SagaEventContext(SagaInstance<TData> instance, E event, MessageContext messageContext) {
        this.instance = instance;
        this.event = event;
        this.messageContext = messageContext;
    }

    public SagaInstance<TData> getInstance() {
        return instance;
    }

    public TData getData() {
        return instance.getData();
    }

    public E getEvent() {
        return event;
    }

    public MessageContext getMessageContext() {
        return messageContext;
    }

    public UUID getSagaId() {
        return instance.getCorrelationId();
    }

    public String getCurrentState() {
        return instance.getCurrentState();
    }

    public void setMetadata(String key, String value) {
        instance.setMetadata(key, value);
    }

    public String getMetadata(String key) {
        return instance.getMetadata(key);
    }

    /**
     * Publish a follow-up message through the inbound message's transport.
     */
    public void publish(String messageType, Object message) {
        messageContext.publish(messageType, message);
    }

    public ServiceResolver services() {
        return messageContext.services();
    }

    public boolean isCancelled() {
        return messageContext.isCancelled();
    }

    /**
     * Record a timeout request against the instance so it can be cancelled later.
     */
    public void trackTimeout(String timeoutId) {
        instance.trackTimeout(timeoutId);
    }

    public boolean clearTimeout(String timeoutId) {
        return instance.clearTimeout(timeoutId);
    }
}
