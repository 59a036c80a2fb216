package com.ivamare.saga.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ivamare.saga.exception.SagaException;
import com.ivamare.saga.model.SagaInstance;

import java.util.Objects;

/**
 * JSON (de)serialization of saga instances, shared by the repository implementations.
 *
 * <p>The mapper must be able to handle {@code java.time} types.
 */
public class SagaInstanceCodec {

    private final ObjectMapper objectMapper;

    public SagaInstanceCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Codec with a mapper configured for saga storage: JSR-310 support, ISO-8601 timestamps,
     * unknown properties ignored.
     */
    public static SagaInstanceCodec withDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return new SagaInstanceCodec(mapper);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public String serialize(SagaInstance<?> instance) {
        try {
            return objectMapper.writeValueAsString(instance);
        } catch (JsonProcessingException e) {
            throw new SagaException("Failed to serialize saga instance " + instance.getCorrelationId(), e);
        }
    }

    public <TData> SagaInstance<TData> deserialize(String json, Class<TData> dataType) {
        JavaType type = objectMapper.getTypeFactory().constructParametricType(SagaInstance.class, dataType);
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SagaException("Failed to deserialize saga instance of " + dataType.getSimpleName(), e);
        }
    }
}
