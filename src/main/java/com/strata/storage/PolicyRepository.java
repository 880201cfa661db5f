package com.strata.storage;

import com.strata.domain.ActionType;
import com.strata.domain.Policy;
import com.strata.domain.StorageTier;
import com.strata.domain.Temperature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for lifecycle policies. Callers validate before writing.
 */
@Repository
public class PolicyRepository {

    private static final Logger log = LoggerFactory.getLogger(PolicyRepository.class);

    private static final String TABLE = "lifecycle_policy";

    private static final RowMapper<Policy> ROW_MAPPER = (rs, rowNum) -> {
        Policy policy = new Policy();
        policy.setId(rs.getLong("policy_id"));
        policy.setName(rs.getString("policy_name"));
        policy.setDatasetId(rs.getString("dataset_id"));
        policy.setEnabled(rs.getBoolean("enabled"));
        policy.setPriority(rs.getInt("priority"));
        policy.setAgeDays(SqlValues.nullableInt(rs, "age_days"));
        policy.setAgeMonths(SqlValues.nullableInt(rs, "age_months"));
        policy.setTemperature(SqlValues.enumValue(rs, "temperature", Temperature.class));
        policy.setMinSizeBytes(SqlValues.nullableLong(rs, "min_size_bytes"));
        policy.setMaxSizeBytes(SqlValues.nullableLong(rs, "max_size_bytes"));
        policy.setCustomCondition(rs.getString("custom_condition"));
        policy.setAction(SqlValues.enumValue(rs, "action_type", ActionType.class));
        policy.setCodec(rs.getString("codec"));
        policy.setDestinationTier(SqlValues.enumValue(rs, "destination_tier", StorageTier.class));
        policy.setLocation(rs.getString("target_location"));
        policy.setCustomAction(rs.getString("custom_action"));
        policy.setRebuildIndexes(rs.getBoolean("rebuild_indexes"));
        policy.setGatherStats(rs.getBoolean("gather_stats"));
        policy.setThresholdProfileId(SqlValues.nullableLong(rs, "threshold_profile_id"));
        policy.setVersion(rs.getInt("policy_version"));
        policy.setCreatedAt(SqlValues.instant(rs, "created_at"));
        policy.setUpdatedAt(SqlValues.instant(rs, "updated_at"));
        return policy;
    };

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public PolicyRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    public Policy insert(Policy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Policy must not be null");
        }
        Instant now = clock.instant();
        policy.setCreatedAt(now);
        policy.setUpdatedAt(now);
        try {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO lifecycle_policy (policy_name, dataset_id, enabled, priority, age_days, age_months, temperature, "
                        + "min_size_bytes, max_size_bytes, custom_condition, action_type, codec, destination_tier, target_location, "
                        + "custom_action, rebuild_indexes, gather_stats, threshold_profile_id, policy_version, created_at, updated_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    new String[] {"policy_id"});
                bindDefinition(ps, policy);
                ps.setInt(19, policy.getVersion());
                ps.setTimestamp(20, SqlValues.timestamp(now));
                ps.setTimestamp(21, SqlValues.timestamp(now));
                return ps;
            }, keyHolder);
            policy.setId(keyHolder.getKey().longValue());
            log.info("Created policy {}", policy);
            return policy;
        } catch (DataAccessException e) {
            log.error("Failed to create policy {}", policy.getName(), e);
            throw new MetadataStoreException("Failed to create policy " + policy.getName(), TABLE, e);
        }
    }

    /**
     * Rewrites the definition and stores the policy's (already bumped) version.
     */
    public Policy update(Policy policy) {
        if (policy == null || policy.getId() == null) {
            throw new IllegalArgumentException("Policy and policy ID must not be null");
        }
        Instant now = clock.instant();
        policy.setUpdatedAt(now);
        try {
            int updated = jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(
                    "UPDATE lifecycle_policy SET policy_name = ?, dataset_id = ?, enabled = ?, priority = ?, age_days = ?, "
                        + "age_months = ?, temperature = ?, min_size_bytes = ?, max_size_bytes = ?, custom_condition = ?, "
                        + "action_type = ?, codec = ?, destination_tier = ?, target_location = ?, custom_action = ?, "
                        + "rebuild_indexes = ?, gather_stats = ?, threshold_profile_id = ?, policy_version = ?, updated_at = ? "
                        + "WHERE policy_id = ?");
                bindDefinition(ps, policy);
                ps.setInt(19, policy.getVersion());
                ps.setTimestamp(20, SqlValues.timestamp(now));
                ps.setLong(21, policy.getId());
                return ps;
            });
            if (updated == 0) {
                throw new IllegalArgumentException("Policy " + policy.getId() + " does not exist");
            }
            log.info("Updated policy {} to version {}", policy, policy.getVersion());
            return policy;
        } catch (DataAccessException e) {
            log.error("Failed to update policy {}", policy.getId(), e);
            throw new MetadataStoreException("Failed to update policy " + policy.getId(), TABLE, e);
        }
    }

    public boolean setEnabled(Long policyId, boolean enabled) {
        try {
            return jdbcTemplate.update("UPDATE lifecycle_policy SET enabled = ?, updated_at = ? WHERE policy_id = ?",
                enabled, SqlValues.timestamp(clock.instant()), policyId) > 0;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to change enabled state of policy " + policyId, TABLE, e);
        }
    }

    public Optional<Policy> findById(Long policyId) {
        if (policyId == null) {
            return Optional.empty();
        }
        try {
            return jdbcTemplate.query("SELECT * FROM lifecycle_policy WHERE policy_id = ?", ROW_MAPPER, policyId)
                .stream().findFirst();
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to read policy " + policyId, TABLE, e);
        }
    }

    public Optional<Policy> findByName(String name) {
        try {
            return jdbcTemplate.query("SELECT * FROM lifecycle_policy WHERE policy_name = ?", ROW_MAPPER, name)
                .stream().findFirst();
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to read policy " + name, TABLE, e);
        }
    }

    public List<Policy> findAll() {
        try {
            return jdbcTemplate.query("SELECT * FROM lifecycle_policy ORDER BY priority, policy_id", ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to list policies", TABLE, e);
        }
    }

    /**
     * Enabled policies in evaluation order (priority, then id).
     */
    public List<Policy> findEnabled() {
        try {
            return jdbcTemplate.query(
                "SELECT * FROM lifecycle_policy WHERE enabled = TRUE ORDER BY priority, policy_id", ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to list enabled policies", TABLE, e);
        }
    }

    public int countByThresholdProfile(Long profileId) {
        try {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM lifecycle_policy WHERE threshold_profile_id = ?", Integer.class, profileId);
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to count policies of profile " + profileId, TABLE, e);
        }
    }

    private static void bindDefinition(PreparedStatement ps, Policy policy) throws SQLException {
        ps.setString(1, policy.getName());
        ps.setString(2, policy.getDatasetId());
        ps.setBoolean(3, policy.isEnabled());
        ps.setInt(4, policy.getPriority());
        ps.setObject(5, policy.getAgeDays(), Types.INTEGER);
        ps.setObject(6, policy.getAgeMonths(), Types.INTEGER);
        ps.setString(7, SqlValues.name(policy.getTemperature()));
        ps.setObject(8, policy.getMinSizeBytes(), Types.BIGINT);
        ps.setObject(9, policy.getMaxSizeBytes(), Types.BIGINT);
        ps.setString(10, policy.getCustomCondition());
        ps.setString(11, SqlValues.name(policy.getAction()));
        ps.setString(12, policy.getCodec());
        ps.setString(13, SqlValues.name(policy.getDestinationTier()));
        ps.setString(14, policy.getLocation());
        ps.setString(15, policy.getCustomAction());
        ps.setBoolean(16, policy.isRebuildIndexes());
        ps.setBoolean(17, policy.isGatherStats());
        ps.setObject(18, policy.getThresholdProfileId(), Types.BIGINT);
    }
}
