package com.strata.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Falls back to the in-memory engine when no storage engine integration is deployed.
 */
@Configuration
public class StorageEngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(StorageEngineConfig.class);

    @Bean
    @ConditionalOnMissingBean(StorageEngine.class)
    public InMemoryStorageEngine inMemoryStorageEngine(Clock clock) {
        logger.warn("No storage engine integration configured, using in-memory storage engine");
        return new InMemoryStorageEngine(clock);
    }
}
