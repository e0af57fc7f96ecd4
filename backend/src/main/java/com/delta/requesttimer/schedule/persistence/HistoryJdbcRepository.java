package com.delta.requesttimer.schedule.persistence;

import com.delta.requesttimer.schedule.model.HistoryQuery;
import com.delta.requesttimer.schedule.model.HistoryRecord;
import com.delta.requesttimer.schedule.model.ScheduleStats;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

@Repository
public class HistoryJdbcRepository {
    private static final int MAX_ERROR_LENGTH = 1000;

    private static final RowMapper<HistoryRecord> HISTORY_ROW = (rs, rowNum) -> new HistoryRecord(
        rs.getLong("id"),
        rs.getString("request_id"),
        rs.getString("schedule_name"),
        toInstant(rs.getTimestamp("requested_at")),
        rs.getString("url"),
        rs.getString("method"),
        rs.getString("headers"),
        rs.getString("request_body"),
        rs.getBoolean("success"),
        rs.getObject("status_code", Integer.class),
        rs.getObject("response_time_ms", Long.class),
        rs.getString("response_headers"),
        rs.getString("response_body"),
        rs.getString("error_message"),
        rs.getInt("attempt_count"),
        toInstant(rs.getTimestamp("created_at"))
    );

    private static final RowMapper<ScheduleStats> STATS_ROW = (rs, rowNum) -> new ScheduleStats(
        rs.getString("schedule_id"),
        rs.getString("schedule_name"),
        rs.getLong("total_requests"),
        rs.getLong("successful_requests"),
        rs.getLong("failed_requests"),
        toInstant(rs.getTimestamp("last_request_time")),
        toInstant(rs.getTimestamp("last_success_time")),
        toInstant(rs.getTimestamp("last_failure_time")),
        rs.getDouble("average_response_time_ms"),
        toInstant(rs.getTimestamp("updated_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public HistoryJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertHistory(HistoryRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("requestId", record.requestId())
            .addValue("scheduleName", record.scheduleName())
            .addValue("requestedAt", toTimestamp(record.timestamp()))
            .addValue("url", record.url())
            .addValue("method", record.method())
            .addValue("headers", record.headers(), Types.VARCHAR)
            .addValue("requestBody", record.requestBody(), Types.VARCHAR)
            .addValue("success", record.success())
            .addValue("statusCode", record.statusCode(), Types.INTEGER)
            .addValue("responseTimeMs", record.responseTimeMs(), Types.BIGINT)
            .addValue("responseHeaders", record.responseHeaders(), Types.VARCHAR)
            .addValue("responseBody", record.responseBody(), Types.VARCHAR)
            .addValue("errorMessage", truncateError(record.errorMessage()), Types.VARCHAR)
            .addValue("attemptCount", Math.max(1, record.attemptCount()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO request_history (
                    request_id,
                    schedule_name,
                    requested_at,
                    url,
                    method,
                    headers,
                    request_body,
                    success,
                    status_code,
                    response_time_ms,
                    response_headers,
                    response_body,
                    error_message,
                    attempt_count
                )
                VALUES (
                    :requestId,
                    :scheduleName,
                    :requestedAt,
                    :url,
                    :method,
                    :headers,
                    :requestBody,
                    :success,
                    :statusCode,
                    :responseTimeMs,
                    :responseHeaders,
                    :responseBody,
                    :errorMessage,
                    :attemptCount
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public ScheduleStats findStats(String scheduleId) {
        List<ScheduleStats> rows = jdbc.query(
            """
                SELECT schedule_id,
                       schedule_name,
                       total_requests,
                       successful_requests,
                       failed_requests,
                       last_request_time,
                       last_success_time,
                       last_failure_time,
                       average_response_time_ms,
                       updated_at
                FROM schedule_stats
                WHERE schedule_id = :scheduleId
                """,
            new MapSqlParameterSource().addValue("scheduleId", scheduleId),
            STATS_ROW
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<ScheduleStats> findAllStats() {
        return jdbc.query(
            """
                SELECT schedule_id,
                       schedule_name,
                       total_requests,
                       successful_requests,
                       failed_requests,
                       last_request_time,
                       last_success_time,
                       last_failure_time,
                       average_response_time_ms,
                       updated_at
                FROM schedule_stats
                ORDER BY schedule_id
                """,
            new MapSqlParameterSource(),
            STATS_ROW
        );
    }

    public void insertStats(ScheduleStats stats) {
        jdbc.update(
            """
                INSERT INTO schedule_stats (
                    schedule_id,
                    schedule_name,
                    total_requests,
                    successful_requests,
                    failed_requests,
                    last_request_time,
                    last_success_time,
                    last_failure_time,
                    average_response_time_ms,
                    updated_at
                )
                VALUES (
                    :scheduleId,
                    :scheduleName,
                    :totalRequests,
                    :successfulRequests,
                    :failedRequests,
                    :lastRequestTime,
                    :lastSuccessTime,
                    :lastFailureTime,
                    :averageResponseTimeMs,
                    :updatedAt
                )
                """,
            statsParams(stats)
        );
    }

    public int updateStats(ScheduleStats stats) {
        return jdbc.update(
            """
                UPDATE schedule_stats
                SET schedule_name = :scheduleName,
                    total_requests = :totalRequests,
                    successful_requests = :successfulRequests,
                    failed_requests = :failedRequests,
                    last_request_time = :lastRequestTime,
                    last_success_time = :lastSuccessTime,
                    last_failure_time = :lastFailureTime,
                    average_response_time_ms = :averageResponseTimeMs,
                    updated_at = :updatedAt
                WHERE schedule_id = :scheduleId
                """,
            statsParams(stats)
        );
    }

    public List<HistoryRecord> findHistory(HistoryQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("prefix", likePrefix(query.scheduleIdPrefix()), Types.VARCHAR)
            .addValue("success", query.success(), Types.BOOLEAN)
            .addValue("from", toTimestamp(query.from()), Types.TIMESTAMP)
            .addValue("to", toTimestamp(query.to()), Types.TIMESTAMP)
            .addValue("limit", Math.max(1, query.limit()));
        return jdbc.query(
            """
                SELECT id,
                       request_id,
                       schedule_name,
                       requested_at,
                       url,
                       method,
                       headers,
                       request_body,
                       success,
                       status_code,
                       response_time_ms,
                       response_headers,
                       response_body,
                       error_message,
                       attempt_count,
                       created_at
                FROM request_history
                WHERE (CAST(:prefix AS VARCHAR(255)) IS NULL OR request_id LIKE :prefix ESCAPE '!')
                  AND (CAST(:success AS BOOLEAN) IS NULL OR success = :success)
                  AND (CAST(:from AS TIMESTAMP) IS NULL OR requested_at >= :from)
                  AND (CAST(:to AS TIMESTAMP) IS NULL OR requested_at <= :to)
                ORDER BY requested_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            HISTORY_ROW
        );
    }

    public long countHistorySince(Instant since) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM request_history
                WHERE requested_at >= :since
                """,
            new MapSqlParameterSource().addValue("since", toTimestamp(since)),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public int deleteHistoryBefore(Instant cutoff) {
        return jdbc.update(
            """
                DELETE FROM request_history
                WHERE requested_at < :cutoff
                """,
            new MapSqlParameterSource().addValue("cutoff", toTimestamp(cutoff))
        );
    }

    private MapSqlParameterSource statsParams(ScheduleStats stats) {
        return new MapSqlParameterSource()
            .addValue("scheduleId", stats.scheduleId())
            .addValue("scheduleName", stats.scheduleName())
            .addValue("totalRequests", stats.totalRequests())
            .addValue("successfulRequests", stats.successfulRequests())
            .addValue("failedRequests", stats.failedRequests())
            .addValue("lastRequestTime", toTimestamp(stats.lastRequestTime()), Types.TIMESTAMP)
            .addValue("lastSuccessTime", toTimestamp(stats.lastSuccessTime()), Types.TIMESTAMP)
            .addValue("lastFailureTime", toTimestamp(stats.lastFailureTime()), Types.TIMESTAMP)
            .addValue("averageResponseTimeMs", stats.averageResponseTimeMs())
            .addValue("updatedAt", toTimestamp(stats.updatedAt() == null ? Instant.now() : stats.updatedAt()));
    }

    private static String likePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return null;
        }
        String escaped = prefix.trim()
            .replace("!", "!!")
            .replace("%", "!%")
            .replace("_", "!_");
        return escaped + "%";
    }

    private static String truncateError(String detail) {
        if (detail == null) {
            return null;
        }
        String trimmed = detail.trim();
        if (trimmed.length() <= MAX_ERROR_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, MAX_ERROR_LENGTH);
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
