package com.strata.monitoring;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Alerts go to the log unless another {@link AlertNotifier} is deployed.
 */
@Configuration
public class MonitoringConfig {

    @Bean
    @ConditionalOnMissingBean(AlertNotifier.class)
    public AlertNotifier loggingAlertNotifier() {
        return new LoggingAlertNotifier();
    }
}
