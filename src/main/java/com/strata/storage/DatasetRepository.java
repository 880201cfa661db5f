package com.strata.storage;

import com.strata.domain.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Registry of datasets under lifecycle management.
 */
@Repository
public class DatasetRepository {

    private static final Logger log = LoggerFactory.getLogger(DatasetRepository.class);

    private static final String TABLE = "lifecycle_dataset";

    private static final RowMapper<Dataset> ROW_MAPPER = (rs, rowNum) -> Dataset.builder()
        .id(rs.getString("dataset_id"))
        .displayName(rs.getString("display_name"))
        .partitionColumn(rs.getString("partition_column"))
        .tierTemplate(rs.getString("tier_template"))
        .createdAt(SqlValues.instant(rs, "created_at"))
        .build();

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public DatasetRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Registers a dataset or updates its template/column.
     */
    public Dataset save(Dataset dataset) {
        if (dataset == null || dataset.getId() == null) {
            throw new IllegalArgumentException("Dataset and dataset ID must not be null");
        }
        try {
            int updated = jdbcTemplate.update(
                "UPDATE lifecycle_dataset SET display_name = ?, partition_column = ?, tier_template = ? WHERE dataset_id = ?",
                dataset.getDisplayName(), dataset.getPartitionColumn(), dataset.getTierTemplate(), dataset.getId());
            if (updated == 0) {
                if (dataset.getCreatedAt() == null) {
                    dataset.setCreatedAt(clock.instant());
                }
                jdbcTemplate.update(
                    "INSERT INTO lifecycle_dataset (dataset_id, display_name, partition_column, tier_template, created_at) VALUES (?, ?, ?, ?, ?)",
                    dataset.getId(), dataset.getDisplayName(), dataset.getPartitionColumn(), dataset.getTierTemplate(),
                    SqlValues.timestamp(dataset.getCreatedAt()));
                log.info("Registered dataset {} (template {})", dataset.getId(), dataset.getTierTemplate());
            } else {
                log.debug("Updated dataset {}", dataset.getId());
            }
            return dataset;
        } catch (DataAccessException e) {
            log.error("Failed to save dataset {}", dataset.getId(), e);
            throw new MetadataStoreException("Failed to save dataset " + dataset.getId(), TABLE, e);
        }
    }

    public Optional<Dataset> findById(String datasetId) {
        if (datasetId == null) {
            return Optional.empty();
        }
        try {
            List<Dataset> result = jdbcTemplate.query(
                "SELECT * FROM lifecycle_dataset WHERE dataset_id = ?", ROW_MAPPER, datasetId);
            return result.stream().findFirst();
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to read dataset " + datasetId, TABLE, e);
        }
    }

    public boolean exists(String datasetId) {
        return findById(datasetId).isPresent();
    }

    public List<Dataset> findAll() {
        try {
            return jdbcTemplate.query("SELECT * FROM lifecycle_dataset ORDER BY dataset_id", ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to list datasets", TABLE, e);
        }
    }
}
