package com.ivamare.saga.repository.impl;

import com.ivamare.saga.exception.DuplicateSagaException;
import com.ivamare.saga.exception.SagaConcurrencyException;
import com.ivamare.saga.model.SagaInstance;
import com.ivamare.saga.repository.SagaInstanceCodec;
import com.ivamare.saga.repository.SagaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory implementation of SagaRepository.
 *
 * <p>Instances are held as JSON snapshots, so every {@link #find} returns an independent copy
 * and concurrent writers are subject to the same revision check as a database store.
 * Intended for tests and single-node deployments.
 */
public class InMemorySagaRepository<TData> implements SagaRepository<TData> {

    private static final Logger log = LoggerFactory.getLogger(InMemorySagaRepository.class);

    private final String sagaType;
    private final Class<TData> dataType;
    private final SagaInstanceCodec codec;
    private final Map<UUID, Snapshot> store = new ConcurrentHashMap<>();

    public InMemorySagaRepository(String sagaType, Class<TData> dataType, SagaInstanceCodec codec) {
        this.sagaType = sagaType;
        this.dataType = dataType;
        this.codec = codec;
    }

    @Override
    public Optional<SagaInstance<TData>> find(UUID correlationId) {
        Snapshot snapshot = store.get(correlationId);
        return snapshot == null ? Optional.empty() : Optional.of(restore(snapshot));
    }

    @Override
    public SagaInstance<TData> create(UUID correlationId, String initialState, TData data) {
        SagaInstance<TData> instance = SagaInstance.create(correlationId, initialState, data);
        Snapshot snapshot = snapshotOf(instance, 1);
        if (store.putIfAbsent(correlationId, snapshot) != null) {
            throw new DuplicateSagaException(sagaType, correlationId);
        }
        instance.markPersisted(snapshot.revision(), snapshot.updatedAt());
        log.debug("Created saga {}.{} in state {}", sagaType, correlationId, initialState);
        return instance;
    }

    @Override
    public void save(SagaInstance<TData> instance) {
        UUID correlationId = instance.getCorrelationId();
        long expected = instance.getRevision();
        Snapshot next = snapshotOf(instance, expected + 1);

        Snapshot stored = store.computeIfPresent(correlationId,
            (id, current) -> current.revision() == expected ? next : current);
        if (stored != next) {
            throw new SagaConcurrencyException(correlationId, expected);
        }

        instance.markPersisted(next.revision(), next.updatedAt());
        log.debug("Saved saga {}.{} (state={}, version={})",
            sagaType, correlationId, instance.getCurrentState(), instance.getVersion());
    }

    @Override
    public boolean delete(UUID correlationId) {
        return store.remove(correlationId) != null;
    }

    @Override
    public List<SagaInstance<TData>> findByState(String state) {
        return select(instance -> state.equals(instance.getCurrentState()));
    }

    @Override
    public List<SagaInstance<TData>> findTimedOut(Duration inactiveFor) {
        Instant threshold = Instant.now().minus(inactiveFor);
        return select(instance -> instance.isActive() && instance.getLastUpdatedAt().isBefore(threshold));
    }

    @Override
    public List<SagaInstance<TData>> findFaulted() {
        return select(SagaInstance::isFaulted);
    }

    @Override
    public int cleanup(Duration olderThan) {
        Instant threshold = Instant.now().minus(olderThan);
        List<SagaInstance<TData>> expired = select(instance ->
            !instance.isActive() && instance.getLastUpdatedAt().isBefore(threshold));
        int removed = 0;
        for (SagaInstance<TData> instance : expired) {
            if (delete(instance.getCorrelationId())) {
                removed++;
            }
        }
        log.info("Cleaned up {} finished {} sagas", removed, sagaType);
        return removed;
    }

    /**
     * Number of stored instances.
     */
    public int size() {
        return store.size();
    }

    private List<SagaInstance<TData>> select(Predicate<SagaInstance<TData>> filter) {
        return store.values().stream()
            .map(this::restore)
            .filter(filter)
            .sorted(Comparator.comparing(SagaInstance::getCreatedAt))
            .toList();
    }

    private Snapshot snapshotOf(SagaInstance<TData> instance, long revision) {
        return new Snapshot(codec.serialize(instance), revision, Instant.now());
    }

    private SagaInstance<TData> restore(Snapshot snapshot) {
        SagaInstance<TData> instance = codec.deserialize(snapshot.json(), dataType);
        instance.markPersisted(snapshot.revision(), snapshot.updatedAt());
        return instance;
    }

    private record Snapshot(String json, long revision, Instant updatedAt) {}
}
