package com.strata.storage;

import com.strata.domain.ThresholdProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for threshold profiles. Ordering is validated before anything reaches the
 * table, and the table's check constraint refuses non-ascending rows as a second line.
 */
@Repository
public class ThresholdProfileRepository {

    private static final Logger log = LoggerFactory.getLogger(ThresholdProfileRepository.class);

    private static final String TABLE = "threshold_profile";

    private static final RowMapper<ThresholdProfile> ROW_MAPPER = (rs, rowNum) -> {
        ThresholdProfile profile = new ThresholdProfile();
        profile.setId(rs.getLong("profile_id"));
        profile.setName(rs.getString("profile_name"));
        profile.setHotDays(rs.getInt("hot_days"));
        profile.setWarmDays(rs.getInt("warm_days"));
        profile.setColdDays(rs.getInt("cold_days"));
        profile.setDescription(rs.getString("description"));
        profile.setCreatedAt(SqlValues.instant(rs, "created_at"));
        profile.setUpdatedAt(SqlValues.instant(rs, "updated_at"));
        return profile;
    };

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public ThresholdProfileRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    public ThresholdProfile insert(ThresholdProfile profile) {
        if (profile == null) {
            throw new IllegalArgumentException("Threshold profile must not be null");
        }
        Instant now = clock.instant();
        try {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO threshold_profile (profile_name, hot_days, warm_days, cold_days, description, created_at, updated_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                    new String[] {"profile_id"});
                ps.setString(1, profile.getName());
                ps.setInt(2, profile.getHotDays());
                ps.setInt(3, profile.getWarmDays());
                ps.setInt(4, profile.getColdDays());
                ps.setString(5, profile.getDescription());
                ps.setTimestamp(6, SqlValues.timestamp(now));
                ps.setTimestamp(7, SqlValues.timestamp(now));
                return ps;
            }, keyHolder);
            profile.setId(keyHolder.getKey().longValue());
            profile.setCreatedAt(now);
            profile.setUpdatedAt(now);
            log.info("Created threshold profile {}", profile);
            return profile;
        } catch (DataAccessException e) {
            log.error("Failed to create threshold profile {}", profile.getName(), e);
            throw new MetadataStoreException("Failed to create threshold profile " + profile.getName(), TABLE, e);
        }
    }

    public ThresholdProfile update(ThresholdProfile profile) {
        if (profile == null || profile.getId() == null) {
            throw new IllegalArgumentException("Threshold profile and profile ID must not be null");
        }
        Instant now = clock.instant();
        try {
            int updated = jdbcTemplate.update(
                "UPDATE threshold_profile SET profile_name = ?, hot_days = ?, warm_days = ?, cold_days = ?, description = ?, updated_at = ? "
                    + "WHERE profile_id = ?",
                profile.getName(), profile.getHotDays(), profile.getWarmDays(), profile.getColdDays(),
                profile.getDescription(), SqlValues.timestamp(now), profile.getId());
            if (updated == 0) {
                throw new IllegalArgumentException("Threshold profile " + profile.getId() + " does not exist");
            }
            profile.setUpdatedAt(now);
            log.info("Updated threshold profile {}", profile);
            return profile;
        } catch (DataAccessException e) {
            log.error("Failed to update threshold profile {}", profile.getId(), e);
            throw new MetadataStoreException("Failed to update threshold profile " + profile.getId(), TABLE, e);
        }
    }

    public Optional<ThresholdProfile> findById(Long profileId) {
        if (profileId == null) {
            return Optional.empty();
        }
        try {
            return jdbcTemplate.query("SELECT * FROM threshold_profile WHERE profile_id = ?", ROW_MAPPER, profileId)
                .stream().findFirst();
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to read threshold profile " + profileId, TABLE, e);
        }
    }

    public Optional<ThresholdProfile> findByName(String name) {
        try {
            return jdbcTemplate.query("SELECT * FROM threshold_profile WHERE profile_name = ?", ROW_MAPPER, name)
                .stream().findFirst();
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to read threshold profile " + name, TABLE, e);
        }
    }

    public List<ThresholdProfile> findAll() {
        try {
            return jdbcTemplate.query("SELECT * FROM threshold_profile ORDER BY profile_name", ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to list threshold profiles", TABLE, e);
        }
    }

    public boolean delete(Long profileId) {
        try {
            boolean deleted = jdbcTemplate.update("DELETE FROM threshold_profile WHERE profile_id = ?", profileId) > 0;
            if (deleted) {
                log.info("Deleted threshold profile {}", profileId);
            }
            return deleted;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to delete threshold profile " + profileId, TABLE, e);
        }
    }
}
