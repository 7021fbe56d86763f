package com.leadharvest.scrape.persistence;

import com.leadharvest.scrape.model.FailureCategory;
import com.leadharvest.scrape.model.RenderMode;
import com.leadharvest.scrape.model.RunStatus;
import com.leadharvest.scrape.model.RunTrigger;
import com.leadharvest.scrape.model.ScrapeRun;
import com.leadharvest.scrape.model.Target;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class ScrapeJdbcRepository {
    private static final int MAX_ERROR_TEXT = 4000;

    private static final RowMapper<Target> TARGET_MAPPER = (rs, rowNum) -> new Target(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getBoolean("enabled"),
        RenderMode.valueOf(rs.getString("render_mode")),
        rs.getString("start_url"),
        rs.getInt("run_every_minutes"),
        rs.getString("config_json"),
        toInstant(rs.getTimestamp("last_run_at"))
    );

    private static final RowMapper<ScrapeRun> RUN_MAPPER = (rs, rowNum) -> new ScrapeRun(
        rs.getLong("id"),
        rs.getLong("target_id"),
        RunTrigger.valueOf(rs.getString("trigger_type")),
        RunStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("finished_at")),
        rs.getInt("item_count"),
        rs.getInt("created_count"),
        rs.getInt("updated_count"),
        rs.getInt("page_count"),
        rs.getString("stats_json"),
        rs.getString("error_text"),
        rs.getString("error_category") == null ? null : FailureCategory.valueOf(rs.getString("error_category"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public ScrapeJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer one = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return one != null && one == 1;
    }

    public long insertTarget(
        String name,
        boolean enabled,
        RenderMode renderMode,
        String startUrl,
        int runEveryMinutes,
        String configJson
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("enabled", enabled)
            .addValue("renderMode", (renderMode == null ? RenderMode.STATIC : renderMode).name())
            .addValue("startUrl", startUrl)
            .addValue("runEveryMinutes", Math.max(1, runEveryMinutes))
            .addValue("configJson", configJson);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_targets (
                    name, enabled, render_mode, start_url, run_every_minutes, config_json
                )
                VALUES (
                    :name, :enabled, :renderMode, :startUrl, :runEveryMinutes, :configJson
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public Optional<Target> findTarget(long targetId) {
        List<Target> rows = jdbc.query(
            """
                SELECT id, name, enabled, render_mode, start_url, run_every_minutes, config_json, last_run_at
                FROM scrape_targets
                WHERE id = :targetId
                """,
            new MapSqlParameterSource().addValue("targetId", targetId),
            TARGET_MAPPER
        );
        return rows.stream().findFirst();
    }

    public Optional<Target> findTargetByName(String name) {
        List<Target> rows = jdbc.query(
            """
                SELECT id, name, enabled, render_mode, start_url, run_every_minutes, config_json, last_run_at
                FROM scrape_targets
                WHERE name = :name
                """,
            new MapSqlParameterSource().addValue("name", name),
            TARGET_MAPPER
        );
        return rows.stream().findFirst();
    }

    public void updateTarget(
        long targetId,
        boolean enabled,
        RenderMode renderMode,
        String startUrl,
        int runEveryMinutes,
        String configJson
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("targetId", targetId)
            .addValue("enabled", enabled)
            .addValue("renderMode", (renderMode == null ? RenderMode.STATIC : renderMode).name())
            .addValue("startUrl", startUrl)
            .addValue("runEveryMinutes", Math.max(1, runEveryMinutes))
            .addValue("configJson", configJson)
            .addValue("now", toTimestamp(Instant.now()));
        jdbc.update(
            """
                UPDATE scrape_targets
                SET enabled = :enabled,
                    render_mode = :renderMode,
                    start_url = :startUrl,
                    run_every_minutes = :runEveryMinutes,
                    config_json = :configJson,
                    updated_at = :now
                WHERE id = :targetId
                """,
            params
        );
    }

    public int disableTargetsExcept(Collection<String> keepNames) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", toTimestamp(Instant.now()));
        if (keepNames == null || keepNames.isEmpty()) {
            return jdbc.update(
                """
                    UPDATE scrape_targets
                    SET enabled = FALSE,
                        updated_at = :now
                    WHERE enabled = TRUE
                    """,
                params
            );
        }
        params.addValue("names", keepNames);
        return jdbc.update(
            """
                UPDATE scrape_targets
                SET enabled = FALSE,
                    updated_at = :now
                WHERE enabled = TRUE
                  AND name NOT IN (:names)
                """,
            params
        );
    }

    public int countTargetsToDisable(Collection<String> keepNames) {
        Integer count;
        if (keepNames == null || keepNames.isEmpty()) {
            count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM scrape_targets WHERE enabled = TRUE",
                new MapSqlParameterSource(),
                Integer.class
            );
        } else {
            count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM scrape_targets WHERE enabled = TRUE AND name NOT IN (:names)",
                new MapSqlParameterSource().addValue("names", keepNames),
                Integer.class
            );
        }
        return count == null ? 0 : count;
    }

    public List<Target> findEnabledTargets() {
        return jdbc.query(
            """
                SELECT id, name, enabled, render_mode, start_url, run_every_minutes, config_json, last_run_at
                FROM scrape_targets
                WHERE enabled = TRUE
                ORDER BY id
                """,
            new MapSqlParameterSource(),
            TARGET_MAPPER
        );
    }

    public void touchLastRunAt(long targetId, Instant at) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("targetId", targetId)
            .addValue("at", toTimestamp(at));
        jdbc.update(
            """
                UPDATE scrape_targets
                SET last_run_at = :at,
                    updated_at = :at
                WHERE id = :targetId
                """,
            params
        );
    }

    public long insertRun(long targetId, RunTrigger trigger, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("targetId", targetId)
            .addValue("trigger", trigger.name())
            .addValue("status", RunStatus.RUNNING.name())
            .addValue("startedAt", toTimestamp(startedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_runs (
                    target_id,
                    trigger_type,
                    status,
                    started_at
                )
                VALUES (
                    :targetId,
                    :trigger,
                    :status,
                    :startedAt
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
     * Moves a run out of RUNNING. Rows already in a terminal status are left untouched.
     *
     * @return true when the run was finalized by this call
     */
    public boolean finalizeRun(
        long runId,
        RunStatus status,
        Instant finishedAt,
        int pageCount,
        int itemCount,
        int createdCount,
        int updatedCount,
        String statsJson,
        String errorText,
        FailureCategory errorCategory
    ) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Run can only be finalized with a terminal status, got " + status);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("status", status.name())
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("pageCount", Math.max(0, pageCount))
            .addValue("itemCount", Math.max(0, itemCount))
            .addValue("createdCount", Math.max(0, createdCount))
            .addValue("updatedCount", Math.max(0, updatedCount))
            .addValue("statsJson", statsJson)
            .addValue("errorText", truncate(errorText, MAX_ERROR_TEXT))
            .addValue("errorCategory", errorCategory == null ? null : errorCategory.name());
        int updated = jdbc.update(
            """
                UPDATE scrape_runs
                SET status = :status,
                    finished_at = :finishedAt,
                    page_count = :pageCount,
                    item_count = :itemCount,
                    created_count = :createdCount,
                    updated_count = :updatedCount,
                    stats_json = :statsJson,
                    error_text = :errorText,
                    error_category = :errorCategory,
                    updated_at = :finishedAt
                WHERE id = :runId
                  AND status = 'RUNNING'
                """,
            params
        );
        return updated > 0;
    }

    public Optional<ScrapeRun> findRun(long runId) {
        List<ScrapeRun> rows = jdbc.query(
            """
                SELECT id, target_id, trigger_type, status, started_at, finished_at,
                       item_count, created_count, updated_count, page_count,
                       stats_json, error_text, error_category
                FROM scrape_runs
                WHERE id = :runId
                """,
            new MapSqlParameterSource().addValue("runId", runId),
            RUN_MAPPER
        );
        return rows.stream().findFirst();
    }

    public List<ScrapeRun> findRecentRuns(long targetId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("targetId", targetId)
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id, target_id, trigger_type, status, started_at, finished_at,
                       item_count, created_count, updated_count, page_count,
                       stats_json, error_text, error_category
                FROM scrape_runs
                WHERE target_id = :targetId
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            RUN_MAPPER
        );
    }

    public int failStaleRuns(Instant startedBefore, Instant finishedAt, String errorText) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedBefore", toTimestamp(startedBefore))
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("errorText", truncate(errorText, MAX_ERROR_TEXT))
            .addValue("errorCategory", FailureCategory.FATAL.name());
        return jdbc.update(
            """
                UPDATE scrape_runs
                SET status = 'FAILED',
                    finished_at = :finishedAt,
                    error_text = :errorText,
                    error_category = :errorCategory,
                    updated_at = :finishedAt
                WHERE status = 'RUNNING'
                  AND started_at < :startedBefore
                """,
            params
        );
    }

    static String truncate(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.length() <= maxLength ? trimmed : trimmed.substring(0, maxLength);
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
