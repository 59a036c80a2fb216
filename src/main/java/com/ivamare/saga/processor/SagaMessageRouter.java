package com.ivamare.saga.processor;

import com.ivamare.saga.message.MessageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Routes inbound messages to the processors of every saga type that handles their event type.
 *
 * <p>Processors are invoked in registration order; the first exception stops routing and is
 * propagated unchanged.
 */
public class SagaMessageRouter {

    private static final Logger log = LoggerFactory.getLogger(SagaMessageRouter.class);

    private final Map<String, SagaMessageProcessor<?>> processors;

    public SagaMessageRouter(List<? extends SagaMessageProcessor<?>> processors) {
        Map<String, SagaMessageProcessor<?>> bySagaType = new LinkedHashMap<>();
        for (SagaMessageProcessor<?> processor : processors) {
            if (bySagaType.putIfAbsent(processor.getSagaType(), processor) != null) {
                throw new IllegalArgumentException("Duplicate processor for saga type " + processor.getSagaType());
            }
        }
        this.processors = Collections.unmodifiableMap(bySagaType);
    }

    public Set<String> sagaTypes() {
        return processors.keySet();
    }

    public Optional<SagaMessageProcessor<?>> getProcessor(String sagaType) {
        return Optional.ofNullable(processors.get(sagaType));
    }

    /**
     * Route a message.
     *
     * @return result per saga type that received the message, in routing order;
     *         empty if no saga handles the event type
     * @throws Exception the first processor exception
     */
    public Map<String, SagaProcessingResult> route(MessageContext context) throws Exception {
        Map<String, SagaProcessingResult> results = new LinkedHashMap<>();
        for (SagaMessageProcessor<?> processor : processors.values()) {
            if (!processor.getStateMachine().handlesEvent(context.eventType())) {
                continue;
            }
            results.put(processor.getSagaType(), processor.process(context));
        }

        if (results.isEmpty()) {
            log.warn("No saga handles event {}, discarding", context.eventType());
        } else {
            log.debug("Routed event {} to {}", context.eventType(), results);
        }
        return results;
    }
}
