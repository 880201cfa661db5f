package com.strata.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.domain.TierTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tier templates, stored as JSON documents keyed by template name.
 */
@Repository
public class TierTemplateRepository {

    private static final Logger log = LoggerFactory.getLogger(TierTemplateRepository.class);

    private static final String TABLE = "tier_template";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TierTemplateRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public TierTemplate save(TierTemplate template) {
        if (template == null || template.getName() == null) {
            throw new IllegalArgumentException("Tier template and template name must not be null");
        }
        Instant now = clock.instant();
        if (template.getCreatedAt() == null) {
            template.setCreatedAt(now);
        }
        template.setUpdatedAt(now);
        try {
            String json = objectMapper.writeValueAsString(template);
            int updated = jdbcTemplate.update(
                "UPDATE tier_template SET description = ?, template_json = ?, updated_at = ? WHERE template_name = ?",
                template.getDescription(), json, SqlValues.timestamp(now), template.getName());
            if (updated == 0) {
                jdbcTemplate.update(
                    "INSERT INTO tier_template (template_name, description, template_json, created_at, updated_at) VALUES (?, ?, ?, ?, ?)",
                    template.getName(), template.getDescription(), json,
                    SqlValues.timestamp(template.getCreatedAt()), SqlValues.timestamp(now));
            }
            log.info("Saved tier template {}", template.getName());
            return template;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize tier template {}", template.getName(), e);
            throw new IllegalArgumentException("Tier template " + template.getName() + " cannot be serialized", e);
        } catch (DataAccessException e) {
            log.error("Failed to save tier template {}", template.getName(), e);
            throw new MetadataStoreException("Failed to save tier template " + template.getName(), TABLE, e);
        }
    }

    public Optional<TierTemplate> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            List<String> rows = jdbcTemplate.queryForList(
                "SELECT template_json FROM tier_template WHERE template_name = ?", String.class, name);
            return rows.stream().findFirst().map(this::deserialize);
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to read tier template " + name, TABLE, e);
        }
    }

    public List<TierTemplate> findAll() {
        try {
            List<String> rows = jdbcTemplate.queryForList(
                "SELECT template_json FROM tier_template ORDER BY template_name", String.class);
            List<TierTemplate> templates = new ArrayList<>();
            for (String json : rows) {
                templates.add(deserialize(json));
            }
            return templates;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to list tier templates", TABLE, e);
        }
    }

    private TierTemplate deserialize(String json) {
        try {
            return objectMapper.readValue(json, TierTemplate.class);
        } catch (JsonProcessingException e) {
            log.error("Stored tier template is not readable: {}", e.getMessage());
            throw new MetadataStoreException("Stored tier template is not readable", TABLE, e);
        }
    }
}
