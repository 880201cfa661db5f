package com.strata.storage;

import com.strata.domain.ClassificationMode;
import com.strata.domain.PartitionTemperature;
import com.strata.domain.Temperature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Latest classifier output per partition.
 */
@Repository
public class PartitionTemperatureRepository {

    private static final Logger log = LoggerFactory.getLogger(PartitionTemperatureRepository.class);

    private static final String TABLE = "partition_temperature";

    private static final RowMapper<PartitionTemperature> ROW_MAPPER = (rs, rowNum) -> PartitionTemperature.builder()
        .datasetId(rs.getString("dataset_id"))
        .partitionName(rs.getString("partition_name"))
        .temperature(SqlValues.enumValue(rs, "temperature", Temperature.class))
        .ageDays(SqlValues.nullableLong(rs, "age_days"))
        .mode(SqlValues.enumValue(rs, "classification_mode", ClassificationMode.class))
        .lastReadAt(SqlValues.instant(rs, "last_read_at"))
        .lastWriteAt(SqlValues.instant(rs, "last_write_at"))
        .warning(rs.getString("warning"))
        .refreshedAt(SqlValues.instant(rs, "refreshed_at"))
        .build();

    private final JdbcTemplate jdbcTemplate;

    public PartitionTemperatureRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void upsert(PartitionTemperature temperature) {
        if (temperature == null || temperature.getDatasetId() == null || temperature.getPartitionName() == null) {
            throw new IllegalArgumentException("Temperature, dataset ID and partition name must not be null");
        }
        try {
            int updated = jdbcTemplate.update(
                "UPDATE partition_temperature SET temperature = ?, age_days = ?, classification_mode = ?, last_read_at = ?, "
                    + "last_write_at = ?, warning = ?, refreshed_at = ? WHERE dataset_id = ? AND partition_name = ?",
                temperature.getTemperature().name(), temperature.getAgeDays(), temperature.getMode().name(),
                SqlValues.timestamp(temperature.getLastReadAt()), SqlValues.timestamp(temperature.getLastWriteAt()),
                temperature.getWarning(), SqlValues.timestamp(temperature.getRefreshedAt()),
                temperature.getDatasetId(), temperature.getPartitionName());
            if (updated == 0) {
                jdbcTemplate.update(
                    "INSERT INTO partition_temperature (dataset_id, partition_name, temperature, age_days, classification_mode, "
                        + "last_read_at, last_write_at, warning, refreshed_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    temperature.getDatasetId(), temperature.getPartitionName(), temperature.getTemperature().name(),
                    temperature.getAgeDays(), temperature.getMode().name(),
                    SqlValues.timestamp(temperature.getLastReadAt()), SqlValues.timestamp(temperature.getLastWriteAt()),
                    temperature.getWarning(), SqlValues.timestamp(temperature.getRefreshedAt()));
            }
        } catch (DataAccessException e) {
            log.error("Failed to store temperature of {}.{}", temperature.getDatasetId(), temperature.getPartitionName(), e);
            throw new MetadataStoreException("Failed to store temperature of " + temperature.getDatasetId() + "."
                + temperature.getPartitionName(), TABLE, e);
        }
    }

    public Optional<PartitionTemperature> find(String datasetId, String partitionName) {
        try {
            return jdbcTemplate.query(
                "SELECT * FROM partition_temperature WHERE dataset_id = ? AND partition_name = ?",
                ROW_MAPPER, datasetId, partitionName).stream().findFirst();
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to read temperature of " + datasetId + "." + partitionName, TABLE, e);
        }
    }

    public List<PartitionTemperature> findByDataset(String datasetId) {
        try {
            return jdbcTemplate.query(
                "SELECT * FROM partition_temperature WHERE dataset_id = ? ORDER BY partition_name", ROW_MAPPER, datasetId);
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to read temperatures of " + datasetId, TABLE, e);
        }
    }

    /**
     * Removes rows of partitions that no longer exist (dropped or merged away).
     */
    public int retainOnly(String datasetId, Collection<String> partitionNames) {
        try {
            List<String> stored = jdbcTemplate.queryForList(
                "SELECT partition_name FROM partition_temperature WHERE dataset_id = ?", String.class, datasetId);
            int removed = 0;
            for (String name : stored) {
                if (!partitionNames.contains(name)) {
                    removed += jdbcTemplate.update(
                        "DELETE FROM partition_temperature WHERE dataset_id = ? AND partition_name = ?", datasetId, name);
                }
            }
            return removed;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to prune temperatures of " + datasetId, TABLE, e);
        }
    }
}
