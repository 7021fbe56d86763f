package com.leadharvest.scrape.persistence;

import com.leadharvest.scrape.model.EnrichmentFilter;
import com.leadharvest.scrape.model.ProspectRecord;
import com.leadharvest.scrape.model.RecordStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

@Repository
public class ProspectJdbcRepository {
    private static final String SELECT_COLUMNS = """
        SELECT id, source_name, source_url, source_ref, full_name, email,
               phone_raw, phone_e164, phone_region, company, website, position_title,
               event_name, event_date, event_datetime, raw_payload, raw_payload_hash,
               status, notes, created_at, updated_at
        FROM prospects
        """;

    private static final RowMapper<ProspectRecord> RECORD_MAPPER = (rs, rowNum) -> {
        Date eventDate = rs.getDate("event_date");
        Timestamp eventDatetime = rs.getTimestamp("event_datetime");
        return new ProspectRecord(
            rs.getLong("id"),
            rs.getString("source_name"),
            rs.getString("source_url"),
            rs.getString("source_ref"),
            rs.getString("full_name"),
            rs.getString("email"),
            rs.getString("phone_raw"),
            rs.getString("phone_e164"),
            rs.getString("phone_region"),
            rs.getString("company"),
            rs.getString("website"),
            rs.getString("position_title"),
            rs.getString("event_name"),
            eventDate == null ? null : eventDate.toLocalDate(),
            eventDatetime == null ? null : eventDatetime.toInstant().atOffset(ZoneOffset.UTC),
            rs.getString("raw_payload"),
            rs.getString("raw_payload_hash"),
            RecordStatus.valueOf(rs.getString("status")),
            rs.getString("notes"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    };

    private final NamedParameterJdbcTemplate jdbc;

    public ProspectJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<ProspectRecord> findById(long id) {
        return queryOne(
            SELECT_COLUMNS + "WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id)
        );
    }

    public Optional<ProspectRecord> findLatestByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return queryOne(
            SELECT_COLUMNS + """
                WHERE LOWER(email) = LOWER(:email)
                ORDER BY id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource().addValue("email", email.trim())
        );
    }

    public Optional<ProspectRecord> findLatestByPhoneE164(String phoneE164) {
        if (phoneE164 == null || phoneE164.isBlank()) {
            return Optional.empty();
        }
        return queryOne(
            SELECT_COLUMNS + """
                WHERE phone_e164 = :phone
                ORDER BY id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource().addValue("phone", phoneE164)
        );
    }

    public Optional<ProspectRecord> findLatestByRawPayloadHash(String hash) {
        if (hash == null || hash.isBlank()) {
            return Optional.empty();
        }
        return queryOne(
            SELECT_COLUMNS + """
                WHERE raw_payload_hash = :hash
                ORDER BY id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource().addValue("hash", hash)
        );
    }

    public Optional<ProspectRecord> findLatestByRawPayloadHashAndSource(String hash, String sourceName) {
        if (hash == null || hash.isBlank()) {
            return Optional.empty();
        }
        return queryOne(
            SELECT_COLUMNS + """
                WHERE raw_payload_hash = :hash
                  AND source_name = :sourceName
                ORDER BY id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource()
                .addValue("hash", hash)
                .addValue("sourceName", sourceName == null ? "" : sourceName)
        );
    }

    public long insert(ProspectRecord record) {
        MapSqlParameterSource params = writeParams(record)
            .addValue("status", (record.status() == null ? RecordStatus.NEW : record.status()).name())
            .addValue("notes", record.notes());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO prospects (
                    source_name, source_url, source_ref, full_name, email,
                    phone_raw, phone_e164, phone_region, company, website, position_title,
                    event_name, event_date, event_datetime, raw_payload, raw_payload_hash,
                    status, notes, created_at, updated_at
                )
                VALUES (
                    :sourceName, :sourceUrl, :sourceRef, :fullName, :email,
                    :phoneRaw, :phoneE164, :phoneRegion, :company, :website, :position,
                    :eventName, :eventDate, :eventDatetime, :rawPayload, :rawPayloadHash,
                    :status, :notes, :now, :now
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    /**
     * Writes every mapped column and the raw payload. Status and notes are owned by
     * {@link #updateStatus} and the operators. Converted and rejected rows are never
     * written.
     *
     * @return false when the row is missing or already terminal
     */
    public boolean update(ProspectRecord record) {
        if (record.id() == null) {
            throw new IllegalArgumentException("Cannot update a record without id");
        }
        MapSqlParameterSource params = writeParams(record).addValue("id", record.id());
        return jdbc.update(
            """
                UPDATE prospects
                SET source_name = :sourceName,
                    source_url = :sourceUrl,
                    source_ref = :sourceRef,
                    full_name = :fullName,
                    email = :email,
                    phone_raw = :phoneRaw,
                    phone_e164 = :phoneE164,
                    phone_region = :phoneRegion,
                    company = :company,
                    website = :website,
                    position_title = :position,
                    event_name = :eventName,
                    event_date = :eventDate,
                    event_datetime = :eventDatetime,
                    raw_payload = :rawPayload,
                    raw_payload_hash = :rawPayloadHash,
                    updated_at = :now
                WHERE id = :id
                  AND status NOT IN ('CONVERTED', 'REJECTED')
                """,
            params
        ) > 0;
    }

    /**
     * Compare-and-set on the status column.
     *
     * @return false when the row is missing or its status is no longer {@code expected}
     */
    public boolean updateStatus(long id, RecordStatus expected, RecordStatus next) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("expected", expected.name())
            .addValue("status", next.name())
            .addValue("now", Timestamp.from(Instant.now()));
        return jdbc.update(
            """
                UPDATE prospects
                SET status = :status,
                    updated_at = :now
                WHERE id = :id
                  AND status = :expected
                """,
            params
        ) > 0;
    }

    public List<ProspectRecord> findEnrichmentCandidates(EnrichmentFilter filter, String sourceName, int limit) {
        String filterClause = switch (filter) {
            case UNENRICHED -> "AND COALESCE(email, '') = '' AND company = ''";
            case NO_CONTACT -> "AND COALESCE(email, '') = ''";
            case ALL -> "";
        };
        String sourceClause = sourceName == null ? "" : "AND source_name = :sourceName";
        return jdbc.query(
            SELECT_COLUMNS + """
                WHERE source_url <> ''
                  AND status NOT IN ('CONVERTED', 'REJECTED')
                  %s
                  %s
                ORDER BY id
                LIMIT :limit
                """.formatted(filterClause, sourceClause),
            new MapSqlParameterSource()
                .addValue("sourceName", sourceName)
                .addValue("limit", Math.max(1, limit)),
            RECORD_MAPPER
        );
    }

    /**
     * Copies the non-blank values of {@code values} into columns that are still blank.
     * Populated columns keep their content. The three phone columns move together,
     * keyed on {@code phone_raw}. Converted and rejected rows are never written.
     *
     * @return false when the row is missing or already terminal
     */
    public boolean fillBlankFields(long id, ProspectRecord values) {
        OffsetDateTime eventDatetime = values.eventDatetime();
        MapSqlParameterSource params = writeParams(values)
            .addValue("id", id)
            .addValue("eventDate", values.eventDate() == null ? null : Date.valueOf(values.eventDate()), Types.DATE)
            .addValue(
                "eventDatetime",
                eventDatetime == null ? null : Timestamp.from(eventDatetime.toInstant()),
                Types.TIMESTAMP
            );
        return jdbc.update(
            """
                UPDATE prospects
                SET phone_e164 = CASE WHEN phone_raw = '' AND :phoneRaw <> '' THEN :phoneE164 ELSE phone_e164 END,
                    phone_region = CASE WHEN phone_raw = '' AND :phoneRaw <> '' THEN :phoneRegion ELSE phone_region END,
                    phone_raw = CASE WHEN phone_raw = '' THEN :phoneRaw ELSE phone_raw END,
                    full_name = CASE WHEN full_name = '' THEN :fullName ELSE full_name END,
                    email = CASE WHEN COALESCE(email, '') = '' THEN :email ELSE email END,
                    company = CASE WHEN company = '' THEN :company ELSE company END,
                    website = CASE WHEN website = '' THEN :website ELSE website END,
                    position_title = CASE WHEN position_title = '' THEN :position ELSE position_title END,
                    event_name = CASE WHEN event_name = '' THEN :eventName ELSE event_name END,
                    event_date = COALESCE(event_date, :eventDate),
                    event_datetime = COALESCE(event_datetime, :eventDatetime),
                    updated_at = :now
                WHERE id = :id
                  AND status NOT IN ('CONVERTED', 'REJECTED')
                """,
            params
        ) > 0;
    }

    private Optional<ProspectRecord> queryOne(String sql, MapSqlParameterSource params) {
        List<ProspectRecord> rows = jdbc.query(sql, params, RECORD_MAPPER);
        return rows.stream().findFirst();
    }

    private MapSqlParameterSource writeParams(ProspectRecord record) {
        OffsetDateTime eventDatetime = record.eventDatetime();
        String email = truncate(record.email(), 320);
        return new MapSqlParameterSource()
            .addValue("sourceName", truncate(record.sourceName(), 200))
            .addValue("sourceUrl", truncate(record.sourceUrl(), 2048))
            .addValue("sourceRef", truncate(record.sourceRef(), 255))
            .addValue("fullName", truncate(record.fullName(), 255))
            .addValue("email", email == null || email.isEmpty() ? null : email)
            .addValue("phoneRaw", truncate(record.phoneRaw(), 64))
            .addValue("phoneE164", truncate(record.phoneE164(), 32))
            .addValue("phoneRegion", truncate(record.phoneRegion(), 8))
            .addValue("company", truncate(record.company(), 255))
            .addValue("website", truncate(record.website(), 2048))
            .addValue("position", truncate(record.position(), 255))
            .addValue("eventName", truncate(record.eventName(), 1000))
            .addValue("eventDate", record.eventDate() == null ? null : Date.valueOf(record.eventDate()))
            .addValue("eventDatetime", eventDatetime == null ? null : Timestamp.from(eventDatetime.toInstant()))
            .addValue("rawPayload", record.rawPayload())
            .addValue("rawPayloadHash", record.rawPayloadHash() == null ? "" : record.rawPayloadHash())
            .addValue("now", Timestamp.from(Instant.now()));
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        return trimmed.length() <= maxLength ? trimmed : trimmed.substring(0, maxLength);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
