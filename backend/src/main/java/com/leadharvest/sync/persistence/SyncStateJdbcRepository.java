package com.leadharvest.sync.persistence;

import com.leadharvest.sync.model.SyncState;
import com.leadharvest.sync.model.SyncStatus;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class SyncStateJdbcRepository {
    private static final int MAX_ERROR_LENGTH = 2000;

    private static final RowMapper<SyncState> STATE_MAPPER = (rs, rowNum) -> new SyncState(
        rs.getLong("id"),
        rs.getLong("record_id"),
        rs.getString("external_id"),
        SyncStatus.valueOf(rs.getString("status")),
        rs.getString("payload_hash"),
        rs.getString("last_payload"),
        rs.getInt("attempts"),
        toInstant(rs.getTimestamp("last_sync_at")),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("next_retry_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public SyncStateJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<SyncState> findByRecordId(long recordId) {
        List<SyncState> rows = jdbc.query(
            """
                SELECT id, record_id, external_id, status, payload_hash, last_payload,
                       attempts, last_sync_at, last_error, next_retry_at
                FROM crm_sync_states
                WHERE record_id = :recordId
                """,
            new MapSqlParameterSource().addValue("recordId", recordId),
            STATE_MAPPER
        );
        return rows.stream().findFirst();
    }

    /**
     * Returns the state of the record, inserting a PENDING row first when there is none.
     * A concurrent insert of the same record is tolerated.
     */
    public SyncState getOrCreate(long recordId) {
        Optional<SyncState> existing = findByRecordId(recordId);
        if (existing.isPresent()) {
            return existing.get();
        }
        Instant now = Instant.now();
        try {
            jdbc.update(
                """
                    INSERT INTO crm_sync_states (record_id, status, attempts, created_at, updated_at)
                    VALUES (:recordId, 'PENDING', 0, :now, :now)
                    """,
                new MapSqlParameterSource()
                    .addValue("recordId", recordId)
                    .addValue("now", Timestamp.from(now))
            );
        } catch (DataIntegrityViolationException ignored) {
            // lost the race against another worker, the row exists now
        }
        return findByRecordId(recordId)
            .orElseThrow(() -> new IllegalStateException("Sync state missing after insert for record " + recordId));
    }

    /**
     * Claims the record for one CRM call. Succeeds when no other worker holds an
     * unexpired lease; {@link #markSynced}, {@link #markFailure} and {@link #releaseLease}
     * give it back.
     */
    public boolean tryAcquireLease(long recordId, Instant now, Instant leaseUntil) {
        return jdbc.update(
            """
                UPDATE crm_sync_states
                SET lease_until = :leaseUntil
                WHERE record_id = :recordId
                  AND (lease_until IS NULL OR lease_until <= :now)
                """,
            new MapSqlParameterSource()
                .addValue("recordId", recordId)
                .addValue("now", Timestamp.from(now))
                .addValue("leaseUntil", Timestamp.from(leaseUntil))
        ) > 0;
    }

    public void releaseLease(long recordId) {
        jdbc.update(
            "UPDATE crm_sync_states SET lease_until = NULL WHERE record_id = :recordId",
            new MapSqlParameterSource().addValue("recordId", recordId)
        );
    }

    /**
     * @param externalId new external id, or blank to keep the stored one
     */
    public void markSynced(long recordId, String externalId, String payloadHash, String payloadJson, Instant syncedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("recordId", recordId)
            .addValue("externalId", externalId == null ? "" : externalId.trim())
            .addValue("payloadHash", payloadHash)
            .addValue("payloadJson", payloadJson)
            .addValue("now", Timestamp.from(syncedAt));
        jdbc.update(
            """
                UPDATE crm_sync_states
                SET status = 'SYNCED',
                    external_id = CASE WHEN :externalId = '' THEN external_id ELSE :externalId END,
                    payload_hash = :payloadHash,
                    last_payload = :payloadJson,
                    attempts = 0,
                    last_sync_at = :now,
                    last_error = NULL,
                    next_retry_at = NULL,
                    lease_until = NULL,
                    updated_at = :now
                WHERE record_id = :recordId
                """,
            params
        );
    }

    public void markFailure(long recordId, int attempts, String error, String payloadJson, Instant nextRetryAt) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("recordId", recordId)
            .addValue("attempts", attempts)
            .addValue("lastError", truncate(error))
            .addValue("payloadJson", payloadJson)
            .addValue("nextRetryAt", Timestamp.from(nextRetryAt))
            .addValue("now", Timestamp.from(now));
        jdbc.update(
            """
                UPDATE crm_sync_states
                SET status = 'ERROR',
                    attempts = :attempts,
                    last_error = :lastError,
                    last_payload = :payloadJson,
                    next_retry_at = :nextRetryAt,
                    lease_until = NULL,
                    updated_at = :now
                WHERE record_id = :recordId
                """,
            params
        );
    }

    public List<SyncState> findDue(Instant now, int maxAttempts, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", Timestamp.from(now))
            .addValue("maxAttempts", maxAttempts)
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id, record_id, external_id, status, payload_hash, last_payload,
                       attempts, last_sync_at, last_error, next_retry_at
                FROM crm_sync_states
                WHERE status IN ('PENDING', 'ERROR')
                  AND (next_retry_at IS NULL OR next_retry_at <= :now)
                  AND attempts < :maxAttempts
                  AND (lease_until IS NULL OR lease_until <= :now)
                ORDER BY next_retry_at ASC NULLS FIRST, id ASC
                LIMIT :limit
                """,
            params,
            STATE_MAPPER
        );
    }

    private static String truncate(String value) {
        if (value == null) {
            return null;
        }
        return value.length() <= MAX_ERROR_LENGTH ? value : value.substring(0, MAX_ERROR_LENGTH);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
