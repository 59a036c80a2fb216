package com.ivamare.saga.processor;

import com.ivamare.saga.message.MessageContext;
import com.ivamare.saga.model.SagaInstance;
import com.ivamare.saga.repository.SagaRepository;
import com.ivamare.saga.statemachine.SagaStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Runs the full lifecycle of one inbound message for one saga type: correlation, instance
 * lookup or creation, dispatch and persistence.
 *
 * <p>This is the only entry point a transport integration needs to call per message.
 * It is stateless; concurrent calls for the same correlation id are not serialized here and
 * the repository's revision check rejects the losing write with
 * {@link com.ivamare.saga.exception.SagaConcurrencyException}. Transports should partition
 * messages by correlation id, or redeliver on that exception.
 *
 * @param <TData> Saga data type
 */
public class SagaMessageProcessor<TData> {

    private static final Logger log = LoggerFactory.getLogger(SagaMessageProcessor.class);

    private final SagaStateMachine<TData> stateMachine;
    private final SagaRepository<TData> repository;
    private final SagaNotFoundHandler notFoundHandler;

    public SagaMessageProcessor(SagaStateMachine<TData> stateMachine, SagaRepository<TData> repository) {
        this(stateMachine, repository, SagaNotFoundHandler.logging());
    }

    public SagaMessageProcessor(
            SagaStateMachine<TData> stateMachine,
            SagaRepository<TData> repository,
            SagaNotFoundHandler notFoundHandler) {
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.notFoundHandler = Objects.requireNonNull(notFoundHandler, "notFoundHandler");
    }

    public String getSagaType() {
        return stateMachine.getSagaType();
    }

    public SagaStateMachine<TData> getStateMachine() {
        return stateMachine;
    }

    public SagaRepository<TData> getRepository() {
        return repository;
    }

    /**
     * Process one inbound message.
     *
     * @return what happened to the message
     * @throws com.ivamare.saga.exception.CorrelationExtractionException if the payload carries
     *         no usable correlation id
     * @throws CancellationException if cancellation was requested before work started or between
     *         handlers; nothing is saved in that case
     * @throws Exception the handler's exception, after the faulted instance was saved, or any
     *         repository exception
     */
    public SagaProcessingResult process(MessageContext context) throws Exception {
        String eventType = context.eventType();
        if (context.isCancelled()) {
            throw new CancellationException("Processing of " + eventType + " was cancelled");
        }

        UUID correlationId = stateMachine.extractCorrelationId(context);

        Optional<SagaInstance<TData>> existing = repository.find(correlationId);
        SagaInstance<TData> instance;
        if (existing.isPresent()) {
            instance = existing.get();
        } else if (stateMachine.canStartSaga(eventType)) {
            instance = repository.create(correlationId, stateMachine.getInitialState(), stateMachine.newData());
            log.info("Created saga {} {} from event {}", getSagaType(), correlationId, eventType);
        } else {
            notFoundHandler.onSagaNotFound(getSagaType(), correlationId, context);
            return SagaProcessingResult.SAGA_NOT_FOUND;
        }

        if (!instance.isActive()) {
            log.info("Ignoring event {} for {} saga {} {}", eventType,
                instance.isFaulted() ? "faulted" : "completed", getSagaType(), correlationId);
            return SagaProcessingResult.INSTANCE_TERMINAL;
        }

        boolean handled;
        try {
            handled = stateMachine.processEvent(instance, context);
        } catch (CancellationException e) {
            log.debug("Processing of {} for saga {} cancelled, not saving", eventType, correlationId);
            throw e;
        } catch (Exception e) {
            saveFaulted(instance, e);
            throw e;
        }

        if (!handled) {
            return SagaProcessingResult.NOT_HANDLED;
        }

        repository.save(instance);
        log.debug("Processed event {} for saga {} {} (state={}, version={})", eventType,
            getSagaType(), correlationId, instance.getCurrentState(), instance.getVersion());
        return SagaProcessingResult.HANDLED;
    }

    private void saveFaulted(SagaInstance<TData> instance, Exception error) {
        if (instance.isActive()) {
            stateMachine.fault(instance, error);
        }
        try {
            repository.save(instance);
        } catch (RuntimeException saveError) {
            log.error("Failed to save faulted saga {} {}", getSagaType(), instance.getCorrelationId(), saveError);
            error.addSuppressed(saveError);
        }
    }
}
