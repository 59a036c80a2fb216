package com.ivamare.saga.message;

import java.util.UUID;

/**
 * Implemented by event payloads that carry their own correlation id.
 */
public interface CorrelatedMessage {

    UUID correlationId();
}
