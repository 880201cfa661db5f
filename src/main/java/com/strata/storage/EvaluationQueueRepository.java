package com.strata.storage;

import com.strata.domain.EvaluationQueueEntry;
import com.strata.domain.FailureKind;
import com.strata.domain.QueueStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The evaluation queue: one row per (policy, dataset, partition), rewritten by every evaluation
 * pass and moved through PENDING, RUNNING and SUCCESS/FAILED by the execution engine.
 *
 * <p>The only multi-step transition is the claim, which is a compare-and-set on {@code status}
 * so that two workers can never both own the same entry.
 */
@Repository
public class EvaluationQueueRepository {

    private static final Logger log = LoggerFactory.getLogger(EvaluationQueueRepository.class);

    private static final String TABLE = "evaluation_queue";

    private static final String CLAIM_ORDER = " ORDER BY priority ASC, partition_boundary ASC NULLS FIRST, queue_id ASC";

    private static final RowMapper<EvaluationQueueEntry> ROW_MAPPER = (rs, rowNum) -> EvaluationQueueEntry.builder()
        .id(rs.getLong("queue_id"))
        .policyId(rs.getLong("policy_id"))
        .policyName(rs.getString("policy_name"))
        .datasetId(rs.getString("dataset_id"))
        .partitionName(rs.getString("partition_name"))
        .priority(rs.getInt("priority"))
        .partitionBoundary(SqlValues.localDate(rs, "partition_boundary"))
        .eligible(rs.getBoolean("eligible"))
        .reason(rs.getString("reason"))
        .status(SqlValues.enumValue(rs, "status", QueueStatus.class))
        .policyVersion(rs.getInt("policy_version"))
        .failureKind(SqlValues.enumValue(rs, "failure_kind", FailureKind.class))
        .executionId(SqlValues.nullableLong(rs, "execution_id"))
        .attempts(rs.getInt("attempts"))
        .evaluatedAt(SqlValues.instant(rs, "evaluated_at"))
        .claimedAt(SqlValues.instant(rs, "claimed_at"))
        .completedAt(SqlValues.instant(rs, "completed_at"))
        .build();

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public EvaluationQueueRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    public Optional<EvaluationQueueEntry> find(Long policyId, String datasetId, String partitionName) {
        try {
            return jdbcTemplate.query(
                "SELECT * FROM evaluation_queue WHERE policy_id = ? AND dataset_id = ? AND partition_name = ?",
                ROW_MAPPER, policyId, datasetId, partitionName).stream().findFirst();
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to read queue entry for policy " + policyId
                + " and partition " + datasetId + "." + partitionName, TABLE, e);
        }
    }

    public Optional<EvaluationQueueEntry> findById(Long queueId) {
        if (queueId == null) {
            return Optional.empty();
        }
        try {
            return jdbcTemplate.query("SELECT * FROM evaluation_queue WHERE queue_id = ?", ROW_MAPPER, queueId)
                .stream().findFirst();
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to read queue entry " + queueId, TABLE, e);
        }
    }

    /**
     * Writes the outcome of one evaluation. A RUNNING row is never overwritten.
     *
     * @return false when the row is currently RUNNING (or was claimed concurrently)
     */
    public boolean upsertEvaluation(EvaluationQueueEntry entry) {
        if (entry == null || entry.getPolicyId() == null || entry.getDatasetId() == null || entry.getPartitionName() == null) {
            throw new IllegalArgumentException("Queue entry, policy ID, dataset ID and partition name must not be null");
        }
        Instant now = entry.getEvaluatedAt() != null ? entry.getEvaluatedAt() : clock.instant();
        entry.setEvaluatedAt(now);
        try {
            int updated = jdbcTemplate.update(
                "UPDATE evaluation_queue SET policy_name = ?, priority = ?, partition_boundary = ?, eligible = ?, reason = ?, "
                    + "status = ?, policy_version = ?, failure_kind = ?, evaluated_at = ?, claimed_at = NULL, completed_at = NULL "
                    + "WHERE policy_id = ? AND dataset_id = ? AND partition_name = ? AND status <> 'RUNNING'",
                entry.getPolicyName(), entry.getPriority(), SqlValues.date(entry.getPartitionBoundary()), entry.isEligible(),
                entry.getReason(), SqlValues.name(entry.getStatus()), entry.getPolicyVersion(),
                SqlValues.name(entry.getFailureKind()), SqlValues.timestamp(now),
                entry.getPolicyId(), entry.getDatasetId(), entry.getPartitionName());
            if (updated > 0) {
                return true;
            }
            if (find(entry.getPolicyId(), entry.getDatasetId(), entry.getPartitionName()).isPresent()) {
                log.debug("Queue entry {} is running, evaluation not recorded", entry.getPartitionKey());
                return false;
            }
            jdbcTemplate.update(
                "INSERT INTO evaluation_queue (policy_id, policy_name, dataset_id, partition_name, priority, partition_boundary, "
                    + "eligible, reason, status, policy_version, failure_kind, attempts, evaluated_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0, ?)",
                entry.getPolicyId(), entry.getPolicyName(), entry.getDatasetId(), entry.getPartitionName(), entry.getPriority(),
                SqlValues.date(entry.getPartitionBoundary()), entry.isEligible(), entry.getReason(),
                SqlValues.name(entry.getStatus()), entry.getPolicyVersion(), SqlValues.name(entry.getFailureKind()),
                SqlValues.timestamp(now));
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Queue entry {} was inserted concurrently", entry.getPartitionKey());
            return false;
        } catch (DataAccessException e) {
            log.error("Failed to record evaluation for policy {} and partition {}",
                entry.getPolicyId(), entry.getPartitionKey(), e);
            throw new MetadataStoreException("Failed to record evaluation for " + entry.getPartitionKey(), TABLE, e);
        }
    }

    /**
     * Eligible PENDING entries in claim order, optionally narrowed to one policy and/or dataset.
     */
    public List<EvaluationQueueEntry> findPending(int limit, Long policyId, String datasetId) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        StringBuilder sql = new StringBuilder("SELECT * FROM evaluation_queue WHERE status = 'PENDING' AND eligible = TRUE");
        List<Object> args = new ArrayList<>();
        if (policyId != null) {
            sql.append(" AND policy_id = ?");
            args.add(policyId);
        }
        if (datasetId != null) {
            sql.append(" AND dataset_id = ?");
            args.add(datasetId);
        }
        sql.append(CLAIM_ORDER).append(" LIMIT ?");
        args.add(limit);
        try {
            return jdbcTemplate.query(sql.toString(), ROW_MAPPER, args.toArray());
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to read pending queue entries", TABLE, e);
        }
    }

    public List<EvaluationQueueEntry> findUpcoming(int limit) {
        return findPending(limit, null, null);
    }

    /**
     * Atomically moves a PENDING entry to RUNNING.
     *
     * @return true when this caller won the claim
     */
    public boolean claim(Long queueId) {
        try {
            boolean claimed = jdbcTemplate.update(
                "UPDATE evaluation_queue SET status = 'RUNNING', claimed_at = ?, attempts = attempts + 1 "
                    + "WHERE queue_id = ? AND status = 'PENDING'",
                SqlValues.timestamp(clock.instant()), queueId) == 1;
            if (!claimed) {
                log.debug("Queue entry {} was not PENDING, claim lost", queueId);
            }
            return claimed;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to claim queue entry " + queueId, TABLE, e);
        }
    }

    /**
     * Moves a RUNNING entry to its final status.
     */
    public boolean complete(Long queueId, QueueStatus status, FailureKind failureKind, Long executionId, String reason) {
        if (status != QueueStatus.SUCCESS && status != QueueStatus.FAILED) {
            throw new IllegalArgumentException("Queue entries complete as SUCCESS or FAILED, not " + status);
        }
        try {
            return jdbcTemplate.update(
                "UPDATE evaluation_queue SET status = ?, failure_kind = ?, execution_id = ?, reason = COALESCE(?, reason), "
                    + "completed_at = ? WHERE queue_id = ? AND status = 'RUNNING'",
                status.name(), SqlValues.name(failureKind), executionId, reason,
                SqlValues.timestamp(clock.instant()), queueId) == 1;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to complete queue entry " + queueId, TABLE, e);
        }
    }

    /**
     * Turns a PENDING entry into SKIPPED without running it.
     */
    public boolean markSkipped(Long queueId, String reason) {
        try {
            return jdbcTemplate.update(
                "UPDATE evaluation_queue SET status = 'SKIPPED', eligible = FALSE, reason = ?, completed_at = ? "
                    + "WHERE queue_id = ? AND status = 'PENDING'",
                reason, SqlValues.timestamp(clock.instant()), queueId) == 1;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to skip queue entry " + queueId, TABLE, e);
        }
    }

    /**
     * Deletes queue rows nobody will act on again.
     *
     * <p>PENDING and SKIPPED rows go once they were last evaluated before {@code pendingRetention}.
     * SUCCESS and retryable FAILED rows go once they completed before {@code completedRetention}.
     * Terminal failures stay, since they block the pair until the policy changes; they leave
     * with their partition through {@link #purgeMissingPartitions}.
     *
     * @param pendingRetention   age after which unclaimed evaluations are dropped
     * @param completedRetention age after which finished executions are dropped
     * @return number of rows deleted
     */
    public int purgeStale(Duration pendingRetention, Duration completedRetention) {
        Instant now = clock.instant();
        Instant pendingCutoff = now.minus(pendingRetention);
        Instant completedCutoff = now.minus(completedRetention);
        try {
            int purgedPending = jdbcTemplate.update(
                "DELETE FROM evaluation_queue WHERE status IN ('PENDING', 'SKIPPED') AND evaluated_at < ?",
                SqlValues.timestamp(pendingCutoff));
            int purgedCompleted = jdbcTemplate.update(
                "DELETE FROM evaluation_queue WHERE completed_at < ? AND (status = 'SUCCESS' "
                    + "OR (status = 'FAILED' AND (failure_kind IS NULL OR failure_kind <> 'TERMINAL')))",
                SqlValues.timestamp(completedCutoff));
            if (purgedPending + purgedCompleted > 0) {
                log.info("Purged {} stale queue entries evaluated before {} and {} completed before {}",
                    purgedPending, pendingCutoff, purgedCompleted, completedCutoff);
            }
            return purgedPending + purgedCompleted;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to purge stale queue entries", TABLE, e);
        }
    }

    /**
     * Deletes a policy's rows for partitions of the dataset that no longer exist, whatever
     * their status except RUNNING.
     *
     * @param livePartitions names of the partitions the dataset has now
     * @return number of rows deleted
     */
    public int purgeMissingPartitions(Long policyId, String datasetId, Collection<String> livePartitions) {
        StringBuilder sql = new StringBuilder(
            "DELETE FROM evaluation_queue WHERE policy_id = ? AND dataset_id = ? AND status <> 'RUNNING'");
        List<Object> args = new ArrayList<>();
        args.add(policyId);
        args.add(datasetId);
        if (!livePartitions.isEmpty()) {
            sql.append(" AND partition_name NOT IN (")
                .append(String.join(", ", Collections.nCopies(livePartitions.size(), "?")))
                .append(')');
            args.addAll(livePartitions);
        }
        try {
            int purged = jdbcTemplate.update(sql.toString(), args.toArray());
            if (purged > 0) {
                log.info("Purged {} queue entries of policy {} for partitions no longer in {}", purged, policyId, datasetId);
            }
            return purged;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to purge queue entries of dropped partitions in " + datasetId, TABLE, e);
        }
    }

    /**
     * Operator reset of the queue. RUNNING entries stay so in-flight work can still complete.
     */
    public int clear() {
        try {
            int deleted = jdbcTemplate.update("DELETE FROM evaluation_queue WHERE status <> 'RUNNING'");
            log.info("Cleared {} queue entries", deleted);
            return deleted;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to clear queue", TABLE, e);
        }
    }

    public List<EvaluationQueueEntry> findAll(QueueStatus status, int limit) {
        try {
            if (status == null) {
                return jdbcTemplate.query("SELECT * FROM evaluation_queue" + CLAIM_ORDER + " LIMIT ?", ROW_MAPPER, limit);
            }
            return jdbcTemplate.query("SELECT * FROM evaluation_queue WHERE status = ?" + CLAIM_ORDER + " LIMIT ?",
                ROW_MAPPER, status.name(), limit);
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to list queue entries", TABLE, e);
        }
    }

    public int countByStatus(QueueStatus status) {
        try {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM evaluation_queue WHERE status = ?", Integer.class, status.name());
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to count queue entries", TABLE, e);
        }
    }
}
