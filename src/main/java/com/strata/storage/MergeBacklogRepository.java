package com.strata.storage;

import com.strata.domain.DeferredMerge;
import com.strata.domain.Granularity;
import com.strata.domain.StorageTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Fine partitions whose merge into a coarse period was deferred.
 */
@Repository
public class MergeBacklogRepository {

    private static final Logger log = LoggerFactory.getLogger(MergeBacklogRepository.class);

    private static final String TABLE = "merge_backlog";

    private static final RowMapper<DeferredMerge> ROW_MAPPER = (rs, rowNum) -> new DeferredMerge(
        rs.getString("dataset_id"),
        rs.getString("partition_name"),
        SqlValues.enumValue(rs, "target_tier", StorageTier.class),
        SqlValues.enumValue(rs, "target_granularity", Granularity.class),
        rs.getString("reason"),
        rs.getInt("attempts"),
        SqlValues.instant(rs, "first_deferred_at"),
        SqlValues.instant(rs, "last_attempt_at"));

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public MergeBacklogRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Records a deferral, or bumps the attempt count of an existing one.
     */
    public void defer(String datasetId, String partitionName, StorageTier targetTier,
                      Granularity targetGranularity, String reason) {
        Instant now = clock.instant();
        try {
            int updated = jdbcTemplate.update(
                "UPDATE merge_backlog SET target_tier = ?, target_granularity = ?, reason = ?, attempts = attempts + 1, "
                    + "last_attempt_at = ? WHERE dataset_id = ? AND partition_name = ?",
                targetTier.name(), targetGranularity.name(), reason, SqlValues.timestamp(now), datasetId, partitionName);
            if (updated == 0) {
                jdbcTemplate.update(
                    "INSERT INTO merge_backlog (dataset_id, partition_name, target_tier, target_granularity, reason, attempts, "
                        + "first_deferred_at, last_attempt_at) VALUES (?, ?, ?, ?, ?, 1, ?, ?)",
                    datasetId, partitionName, targetTier.name(), targetGranularity.name(), reason,
                    SqlValues.timestamp(now), SqlValues.timestamp(now));
            }
        } catch (DataAccessException e) {
            log.error("Failed to defer merge of {}.{}", datasetId, partitionName, e);
            throw new MetadataStoreException("Failed to defer merge of " + datasetId + "." + partitionName, TABLE, e);
        }
    }

    public boolean remove(String datasetId, String partitionName) {
        try {
            return jdbcTemplate.update(
                "DELETE FROM merge_backlog WHERE dataset_id = ? AND partition_name = ?", datasetId, partitionName) > 0;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to remove backlog entry " + datasetId + "." + partitionName, TABLE, e);
        }
    }

    /**
     * Oldest attempts first.
     */
    public List<DeferredMerge> findAll() {
        try {
            return jdbcTemplate.query("SELECT * FROM merge_backlog ORDER BY last_attempt_at, dataset_id, partition_name",
                ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to read merge backlog", TABLE, e);
        }
    }
}
