package com.ivamare.saga.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ivamare.saga.exception.InvalidSagaOperationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One in-flight saga: current state, accumulated business data and lifecycle bookkeeping.
 *
 * <p>Instances are mutated only through {@link #transitionTo}, {@link #complete} and
 * {@link #fault}. Once completed or faulted an instance accepts no further transitions.
 *
 * <p>The version is incremented once per applied state transition. The revision is a
 * separate persistence token: repositories set it on every read and write and compare it
 * on save to reject stale writes.
 *
 * @param <TData> Business data type
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE,
    setterVisibility = JsonAutoDetect.Visibility.NONE)
public class SagaInstance<TData> {

    public static final String COMPLETED_REASON = "Completed";
    public static final String FAULTED_REASON_PREFIX = "Faulted: ";
    public static final String UNKNOWN_FAULT_MESSAGE = "Saga faulted without an error message";

    private UUID correlationId;
    private String currentState;
    private TData data;
    private long version;
    private Instant createdAt;
    private Instant lastUpdatedAt;
    private Instant completedAt;
    private Instant faultedAt;
    private String errorMessage;
    private List<SagaError> errors = new ArrayList<>();
    private Map<String, String> metadata = new LinkedHashMap<>();
    private Set<String> scheduledTimeouts = new LinkedHashSet<>();
    private List<SagaStateTransition> stateHistory = new ArrayList<>();

    @JsonIgnore
    private long revision;

    // For deserialization
    protected SagaInstance() {
    }

    private SagaInstance(UUID correlationId, String initialState, TData data, Instant now) {
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.currentState = Objects.requireNonNull(initialState, "initialState");
        this.data = data;
        this.createdAt = now;
        this.lastUpdatedAt = now;
    }

    /**
     * Create a new instance in the given initial state with version 0.
     */
    public static <TData> SagaInstance<TData> create(UUID correlationId, String initialState, TData data) {
        return new SagaInstance<>(correlationId, initialState, data, Instant.now());
    }

    // ========== Lifecycle ==========

    /**
     * Move to a new state, recording the transition and incrementing the version.
     *
     * @throws InvalidSagaOperationException if the instance is completed or faulted
     */
    public void transitionTo(String targetState, String reason) {
        Objects.requireNonNull(targetState, "targetState");
        if (!isActive()) {
            throw new InvalidSagaOperationException("Cannot transition saga " + correlationId
                + " to " + targetState + ": instance is " + (isFaulted() ? "faulted" : "completed"));
        }
        Instant now = Instant.now();
        stateHistory.add(new SagaStateTransition(currentState, targetState, now, reason));
        currentState = targetState;
        version++;
        lastUpdatedAt = now;
    }

    /**
     * Mark the instance completed. No-op if already completed.
     *
     * @throws InvalidSagaOperationException if the instance is faulted
     */
    public void complete() {
        if (isCompleted()) {
            return;
        }
        if (isFaulted()) {
            throw new InvalidSagaOperationException("Cannot complete faulted saga " + correlationId);
        }
        Instant now = Instant.now();
        completedAt = now;
        lastUpdatedAt = now;
        stateHistory.add(new SagaStateTransition(currentState, currentState, now, COMPLETED_REASON));
    }

    /**
     * Mark the instance faulted with the given error.
     *
     * <p>The error is always appended to the error log; the fault timestamp and history
     * marker are recorded only the first time.
     *
     * @throws InvalidSagaOperationException if the instance is completed
     */
    public void fault(SagaError error) {
        Objects.requireNonNull(error, "error");
        if (isCompleted()) {
            throw new InvalidSagaOperationException("Cannot fault completed saga " + correlationId);
        }
        errors.add(error);
        errorMessage = error.message();
        lastUpdatedAt = error.occurredAt();
        if (faultedAt == null) {
            faultedAt = error.occurredAt();
            stateHistory.add(new SagaStateTransition(
                currentState, currentState, faultedAt, FAULTED_REASON_PREFIX + error.message()));
        }
    }

    public void fault(Throwable error) {
        fault(SagaError.of(error));
    }

    /**
     * Mark the instance faulted with a plain message. A blank message is recorded as
     * {@value #UNKNOWN_FAULT_MESSAGE}.
     */
    public void fault(String message) {
        String text = message != null && !message.isBlank() ? message : UNKNOWN_FAULT_MESSAGE;
        fault(new SagaError(text, null, Instant.now()));
    }

    @JsonIgnore
    public boolean isCompleted() {
        return completedAt != null;
    }

    @JsonIgnore
    public boolean isFaulted() {
        return faultedAt != null;
    }

    @JsonIgnore
    public boolean isActive() {
        return !isCompleted() && !isFaulted();
    }

    // ========== Side channels ==========

    public void setMetadata(String key, String value) {
        metadata.put(key, value);
    }

    public String getMetadata(String key) {
        return metadata.get(key);
    }

    /**
     * Record an outstanding timeout request. Scheduling itself happens elsewhere.
     */
    public void trackTimeout(String timeoutId) {
        scheduledTimeouts.add(timeoutId);
    }

    /**
     * Forget a timeout request.
     *
     * @return true if the timeout was tracked
     */
    public boolean clearTimeout(String timeoutId) {
        return scheduledTimeouts.remove(timeoutId);
    }

    // ========== Persistence support ==========

    /**
     * Called by repositories after the instance has been read from or written to the store.
     *
     * @param revision Revision now held by the store
     * @param at Store's last-update timestamp (nullable)
     */
    public void markPersisted(long revision, Instant at) {
        this.revision = revision;
        if (at != null) {
            this.lastUpdatedAt = at;
        }
    }

    // ========== Accessors ==========

    public UUID getCorrelationId() {
        return correlationId;
    }

    public String getCurrentState() {
        return currentState;
    }

    public TData getData() {
        return data;
    }

    public void setData(TData data) {
        this.data = data;
    }

    public long getVersion() {
        return version;
    }

    public long getRevision() {
        return revision;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastUpdatedAt() {
        return lastUpdatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getFaultedAt() {
        return faultedAt;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public List<SagaError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public Map<String, String> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Set<String> getScheduledTimeouts() {
        return Collections.unmodifiableSet(scheduledTimeouts);
    }

    public List<SagaStateTransition> getStateHistory() {
        return Collections.unmodifiableList(stateHistory);
    }

    @Override
    public String toString() {
        return "SagaInstance{correlationId=" + correlationId
            + ", currentState=" + currentState
            + ", version=" + version
            + ", completed=" + isCompleted()
            + ", faulted=" + isFaulted() + "}";
    }
}
