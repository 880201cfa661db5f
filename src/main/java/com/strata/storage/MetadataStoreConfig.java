package com.strata.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Connection pool and JdbcTemplate for the lifecycle metadata store
 * (policies, profiles, templates, queue, execution log).
 */
@Configuration
public class MetadataStoreConfig {
    private static final Logger logger = LoggerFactory.getLogger(MetadataStoreConfig.class);

    @Value("${strata.store.url:jdbc:h2:mem:strata;DB_CLOSE_DELAY=-1}")
    private String url;

    @Value("${strata.store.username:sa}")
    private String username;

    @Value("${strata.store.password:}")
    private String password;

    @Value("${strata.store.pool.size:10}")
    private int poolSize;

    @Bean
    public DataSource metadataDataSource() {
        try {
            HikariConfig config = new HikariConfig();
            config.setPoolName("strata-metadata");
            config.setJdbcUrl(url);
            config.setUsername(username);
            config.setPassword(password);

            config.setMaximumPoolSize(poolSize);
            config.setMinimumIdle(2);
            config.setConnectionTimeout(30000);
            config.setIdleTimeout(600000);
            config.setMaxLifetime(1800000);

            HikariDataSource dataSource = new HikariDataSource(config);
            logger.info("Metadata store DataSource initialized: {}", url);
            return dataSource;

        } catch (Exception e) {
            logger.error("Failed to initialize metadata store DataSource", e);
            throw new MetadataStoreException("Metadata store DataSource initialization failed", null, e);
        }
    }

    @Bean
    public JdbcTemplate metadataJdbcTemplate(DataSource metadataDataSource) {
        return new JdbcTemplate(metadataDataSource);
    }
}
