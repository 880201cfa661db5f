package com.strata.storage;

import com.strata.domain.ActionType;
import com.strata.domain.ExecutionLogEntry;
import com.strata.domain.ExecutionStatus;
import com.strata.domain.ExecutionTrigger;
import com.strata.domain.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only audit log of actions. An entry is inserted as RUNNING and completed once.
 */
@Repository
public class ExecutionLogRepository {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLogRepository.class);

    private static final String TABLE = "execution_log";

    private static final int MAX_ERROR_LENGTH = 4000;

    private static final RowMapper<ExecutionLogEntry> ROW_MAPPER = (rs, rowNum) -> ExecutionLogEntry.builder()
        .id(rs.getLong("execution_id"))
        .policyId(SqlValues.nullableLong(rs, "policy_id"))
        .policyName(rs.getString("policy_name"))
        .datasetId(rs.getString("dataset_id"))
        .partitionName(rs.getString("partition_name"))
        .action(SqlValues.enumValue(rs, "action_type", ActionType.class))
        .status(SqlValues.enumValue(rs, "status", ExecutionStatus.class))
        .trigger(SqlValues.enumValue(rs, "execution_trigger", ExecutionTrigger.class))
        .sizeBefore(SqlValues.nullableLong(rs, "size_before"))
        .sizeAfter(SqlValues.nullableLong(rs, "size_after"))
        .locationBefore(rs.getString("location_before"))
        .locationAfter(rs.getString("location_after"))
        .codecBefore(rs.getString("codec_before"))
        .codecAfter(rs.getString("codec_after"))
        .errorCode(rs.getString("error_code"))
        .errorMessage(rs.getString("error_message"))
        .failureKind(SqlValues.enumValue(rs, "failure_kind", FailureKind.class))
        .detail(rs.getString("detail"))
        .startedAt(SqlValues.instant(rs, "started_at"))
        .endedAt(SqlValues.instant(rs, "ended_at"))
        .durationMs(SqlValues.nullableLong(rs, "duration_ms"))
        .build();

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public ExecutionLogRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Inserts the entry in RUNNING state and assigns its id.
     */
    public ExecutionLogEntry start(ExecutionLogEntry entry) {
        if (entry == null || entry.getAction() == null) {
            throw new IllegalArgumentException("Log entry and action must not be null");
        }
        Instant startedAt = entry.getStartedAt() != null ? entry.getStartedAt() : clock.instant();
        entry.setStartedAt(startedAt);
        entry.setStatus(ExecutionStatus.RUNNING);
        if (entry.getTrigger() == null) {
            entry.setTrigger(ExecutionTrigger.SCHEDULED);
        }
        try {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO execution_log (policy_id, policy_name, dataset_id, partition_name, action_type, status, "
                        + "execution_trigger, size_before, location_before, codec_before, detail, started_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    new String[] {"execution_id"});
                ps.setObject(1, entry.getPolicyId(), Types.BIGINT);
                ps.setString(2, entry.getPolicyName());
                ps.setString(3, entry.getDatasetId());
                ps.setString(4, entry.getPartitionName());
                ps.setString(5, entry.getAction().name());
                ps.setString(6, ExecutionStatus.RUNNING.name());
                ps.setString(7, entry.getTrigger().name());
                ps.setObject(8, entry.getSizeBefore(), Types.BIGINT);
                ps.setString(9, entry.getLocationBefore());
                ps.setString(10, entry.getCodecBefore());
                ps.setString(11, entry.getDetail());
                ps.setTimestamp(12, SqlValues.timestamp(startedAt));
                return ps;
            }, keyHolder);
            entry.setId(keyHolder.getKey().longValue());
            return entry;
        } catch (DataAccessException e) {
            log.error("Failed to open log entry for {} on {}.{}", entry.getAction(),
                entry.getDatasetId(), entry.getPartitionName(), e);
            throw new MetadataStoreException("Failed to open log entry for " + entry.getDatasetId() + "."
                + entry.getPartitionName(), TABLE, e);
        }
    }

    /**
     * Writes the terminal state of a RUNNING entry, computing the end time and duration.
     *
     * @return false if the entry was already completed
     */
    public boolean complete(ExecutionLogEntry entry) {
        if (entry == null || entry.getId() == null) {
            throw new IllegalArgumentException("Log entry and execution ID must not be null");
        }
        if (entry.getStatus() != ExecutionStatus.SUCCESS && entry.getStatus() != ExecutionStatus.FAILED) {
            throw new IllegalArgumentException("Log entries complete as SUCCESS or FAILED, not " + entry.getStatus());
        }
        Instant endedAt = clock.instant();
        entry.setEndedAt(endedAt);
        if (entry.getStartedAt() != null) {
            entry.setDurationMs(Duration.between(entry.getStartedAt(), endedAt).toMillis());
        }
        try {
            int updated = jdbcTemplate.update(
                "UPDATE execution_log SET status = ?, size_after = ?, location_after = ?, codec_after = ?, error_code = ?, "
                    + "error_message = ?, failure_kind = ?, detail = COALESCE(?, detail), ended_at = ?, duration_ms = ? "
                    + "WHERE execution_id = ? AND status = 'RUNNING'",
                entry.getStatus().name(), entry.getSizeAfter(), entry.getLocationAfter(), entry.getCodecAfter(),
                entry.getErrorCode(), truncate(entry.getErrorMessage()), SqlValues.name(entry.getFailureKind()),
                entry.getDetail(), SqlValues.timestamp(endedAt), entry.getDurationMs(), entry.getId());
            if (updated == 0) {
                log.warn("Log entry {} was already completed", entry.getId());
            }
            return updated == 1;
        } catch (DataAccessException e) {
            log.error("Failed to complete log entry {}", entry.getId(), e);
            throw new MetadataStoreException("Failed to complete log entry " + entry.getId(), TABLE, e);
        }
    }

    public Optional<ExecutionLogEntry> findById(Long executionId) {
        try {
            return jdbcTemplate.query("SELECT * FROM execution_log WHERE execution_id = ?", ROW_MAPPER, executionId)
                .stream().findFirst();
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to read log entry " + executionId, TABLE, e);
        }
    }

    /**
     * Newest first.
     */
    public List<ExecutionLogEntry> find(ExecutionLogQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM execution_log WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (query.getDatasetId() != null) {
            sql.append(" AND dataset_id = ?");
            args.add(query.getDatasetId());
        }
        if (query.getPolicyId() != null) {
            sql.append(" AND policy_id = ?");
            args.add(query.getPolicyId());
        }
        if (query.getStatus() != null) {
            sql.append(" AND status = ?");
            args.add(query.getStatus().name());
        }
        if (query.getFrom() != null) {
            sql.append(" AND started_at >= ?");
            args.add(SqlValues.timestamp(query.getFrom()));
        }
        if (query.getTo() != null) {
            sql.append(" AND started_at < ?");
            args.add(SqlValues.timestamp(query.getTo()));
        }
        sql.append(" ORDER BY started_at DESC, execution_id DESC LIMIT ?");
        args.add(query.getLimit());
        try {
            return jdbcTemplate.query(sql.toString(), ROW_MAPPER, args.toArray());
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to query execution log", TABLE, e);
        }
    }

    public int countFailuresSince(Instant since) {
        try {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM execution_log WHERE status = 'FAILED' AND ended_at >= ?",
                Integer.class, SqlValues.timestamp(since));
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to count recent failures", TABLE, e);
        }
    }

    public List<PolicyExecutionStats> statistics() {
        try {
            return jdbcTemplate.query(
                "SELECT policy_id, MAX(policy_name) AS policy_name, "
                    + "SUM(CASE WHEN status = 'SUCCESS' THEN 1 ELSE 0 END) AS successes, "
                    + "SUM(CASE WHEN status = 'FAILED' THEN 1 ELSE 0 END) AS failures, "
                    + "COALESCE(SUM(CASE WHEN status = 'SUCCESS' AND size_before IS NOT NULL AND size_after IS NOT NULL "
                    + "THEN size_before - size_after ELSE 0 END), 0) AS space_saved, "
                    + "COALESCE(AVG(CAST(duration_ms AS DOUBLE)), 0) AS avg_duration "
                    + "FROM execution_log WHERE policy_id IS NOT NULL GROUP BY policy_id ORDER BY policy_id",
                (rs, rowNum) -> new PolicyExecutionStats(
                    rs.getLong("policy_id"),
                    rs.getString("policy_name"),
                    rs.getLong("successes"),
                    rs.getLong("failures"),
                    rs.getLong("space_saved"),
                    Math.round(rs.getDouble("avg_duration") * 100.0) / 100.0));
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to aggregate execution statistics", TABLE, e);
        }
    }

    /**
     * Retention cleanup. RUNNING entries are never removed.
     */
    public int deleteCompletedBefore(Instant cutoff) {
        try {
            int deleted = jdbcTemplate.update(
                "DELETE FROM execution_log WHERE status <> 'RUNNING' AND started_at < ?", SqlValues.timestamp(cutoff));
            if (deleted > 0) {
                log.info("Removed {} execution log entries older than {}", deleted, cutoff);
            }
            return deleted;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to apply log retention", TABLE, e);
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
