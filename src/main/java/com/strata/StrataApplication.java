package com.strata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Main application class for the Strata lifecycle tiering engine.
 *
 * Strata manages time-partitioned datasets across HOT, WARM and COLD storage tiers:
 * - Plans the initial partition layout of a dataset from a tier template
 * - Reclassifies partitions by age or access recency
 * - Evaluates declarative lifecycle policies against every partition
 * - Executes eligible actions with a bounded worker pool inside an execution window
 * - Consolidates fine partitions into coarse ones after they move tiers
 *
 * @author Strata Team
 * @version 1.0.0
 * @since 2025-11-10
 */
@SpringBootApplication
@EnableScheduling
public class StrataApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrataApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
