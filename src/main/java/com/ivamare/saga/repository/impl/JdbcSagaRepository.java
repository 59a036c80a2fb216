package com.ivamare.saga.repository.impl;

import com.ivamare.saga.exception.DuplicateSagaException;
import com.ivamare.saga.exception.SagaConcurrencyException;
import com.ivamare.saga.model.SagaInstance;
import com.ivamare.saga.repository.SagaInstanceCodec;
import com.ivamare.saga.repository.SagaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * JDBC implementation of SagaRepository for PostgreSQL.
 *
 * <p>The instance is stored as a jsonb document next to the columns needed for lookups.
 * Rows are keyed by (saga_type, correlation_id); the revision column guards against lost
 * updates. See {@code db/saga-schema.sql} for the table definition.
 */
public class JdbcSagaRepository<TData> implements SagaRepository<TData> {

    private static final Logger log = LoggerFactory.getLogger(JdbcSagaRepository.class);

    public static final String DEFAULT_TABLE = "saga.saga_instance";

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private static final String COLUMNS = "correlation_id, body, revision, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final SagaInstanceCodec codec;
    private final String sagaType;
    private final Class<TData> dataType;
    private final String table;
    private final RowMapper<SagaInstance<TData>> instanceMapper;

    public JdbcSagaRepository(JdbcTemplate jdbcTemplate, SagaInstanceCodec codec,
                              String sagaType, Class<TData> dataType) {
        this(jdbcTemplate, codec, sagaType, dataType, DEFAULT_TABLE);
    }

    public JdbcSagaRepository(JdbcTemplate jdbcTemplate, SagaInstanceCodec codec,
                              String sagaType, Class<TData> dataType, String table) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid saga table name: " + table);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.sagaType = sagaType;
        this.dataType = dataType;
        this.table = table;
        this.instanceMapper = createInstanceMapper();
    }

    private RowMapper<SagaInstance<TData>> createInstanceMapper() {
        return (rs, rowNum) -> {
            SagaInstance<TData> instance = codec.deserialize(rs.getString("body"), dataType);
            instance.markPersisted(rs.getLong("revision"), rs.getTimestamp("updated_at").toInstant());
            return instance;
        };
    }

    @Override
    public Optional<SagaInstance<TData>> find(UUID correlationId) {
        String sql = """
            SELECT %s
            FROM %s
            WHERE saga_type = ? AND correlation_id = ?
            """.formatted(COLUMNS, table);

        List<SagaInstance<TData>> results = jdbcTemplate.query(sql, instanceMapper, sagaType, correlationId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public SagaInstance<TData> create(UUID correlationId, String initialState, TData data) {
        SagaInstance<TData> instance = SagaInstance.create(correlationId, initialState, data);
        Instant now = instance.getCreatedAt();

        String sql = """
            INSERT INTO %s (
                saga_type, correlation_id, current_state, version, revision,
                body, created_at, updated_at, completed_at, faulted_at
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?)
            """.formatted(table);

        try {
            jdbcTemplate.update(sql,
                sagaType,
                correlationId,
                initialState,
                instance.getVersion(),
                1L,
                codec.serialize(instance),
                Timestamp.from(now),
                Timestamp.from(now),
                null,
                null
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateSagaException(sagaType, correlationId);
        }

        instance.markPersisted(1L, now);
        log.debug("Created saga {}.{} in state {}", sagaType, correlationId, initialState);
        return instance;
    }

    @Override
    public void save(SagaInstance<TData> instance) {
        long expected = instance.getRevision();
        Instant now = Instant.now();

        String sql = """
            UPDATE %s SET
                current_state = ?,
                version = ?,
                revision = ?,
                body = ?::jsonb,
                updated_at = ?,
                completed_at = ?,
                faulted_at = ?
            WHERE saga_type = ? AND correlation_id = ? AND revision = ?
            """.formatted(table);

        int updated = jdbcTemplate.update(sql,
            instance.getCurrentState(),
            instance.getVersion(),
            expected + 1,
            codec.serialize(instance),
            Timestamp.from(now),
            toTimestamp(instance.getCompletedAt()),
            toTimestamp(instance.getFaultedAt()),
            sagaType,
            instance.getCorrelationId(),
            expected
        );

        if (updated == 0) {
            throw new SagaConcurrencyException(instance.getCorrelationId(), expected);
        }

        instance.markPersisted(expected + 1, now);
        log.debug("Saved saga {}.{} (state={}, version={})",
            sagaType, instance.getCorrelationId(), instance.getCurrentState(), instance.getVersion());
    }

    @Override
    public boolean delete(UUID correlationId) {
        String sql = "DELETE FROM %s WHERE saga_type = ? AND correlation_id = ?".formatted(table);
        return jdbcTemplate.update(sql, sagaType, correlationId) > 0;
    }

    @Override
    public List<SagaInstance<TData>> findByState(String state) {
        String sql = """
            SELECT %s
            FROM %s
            WHERE saga_type = ? AND current_state = ?
            ORDER BY created_at ASC
            """.formatted(COLUMNS, table);

        return jdbcTemplate.query(sql, instanceMapper, sagaType, state);
    }

    @Override
    public List<SagaInstance<TData>> findTimedOut(Duration inactiveFor) {
        String sql = """
            SELECT %s
            FROM %s
            WHERE saga_type = ?
              AND completed_at IS NULL AND faulted_at IS NULL
              AND updated_at < ?
            ORDER BY updated_at ASC
            """.formatted(COLUMNS, table);

        return jdbcTemplate.query(sql, instanceMapper, sagaType, Timestamp.from(Instant.now().minus(inactiveFor)));
    }

    @Override
    public List<SagaInstance<TData>> findFaulted() {
        String sql = """
            SELECT %s
            FROM %s
            WHERE saga_type = ? AND faulted_at IS NOT NULL
            ORDER BY faulted_at ASC
            """.formatted(COLUMNS, table);

        return jdbcTemplate.query(sql, instanceMapper, sagaType);
    }

    @Override
    public int cleanup(Duration olderThan) {
        String sql = """
            DELETE FROM %s
            WHERE saga_type = ?
              AND (completed_at IS NOT NULL OR faulted_at IS NOT NULL)
              AND updated_at < ?
            """.formatted(table);

        int removed = jdbcTemplate.update(sql, sagaType, Timestamp.from(Instant.now().minus(olderThan)));
        log.info("Cleaned up {} finished {} sagas", removed, sagaType);
        return removed;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
