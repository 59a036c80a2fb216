package com.ivamare.saga.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Entry in a saga instance's state history.
 *
 * <p>Lifecycle markers (completion, fault) are recorded with {@code fromState} equal to
 * {@code toState}, so consecutive entries always chain.
 *
 * @param fromState State before the entry was recorded
 * @param toState State after the entry was recorded
 * @param timestamp When the entry was recorded
 * @param reason Why the entry was recorded (e.g. "Event: PaymentCompleted")
 */
public record SagaStateTransition(
    String fromState,
    String toState,
    Instant timestamp,
    String reason
) {
    /**
     * Whether this entry changed the current state.
     */
    @JsonIgnore
    public boolean isStateChange() {
        return fromState == null ? toState != null : !fromState.equals(toState);
    }
}
