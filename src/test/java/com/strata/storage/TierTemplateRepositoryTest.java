package com.strata.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.strata.domain.Granularity;
import com.strata.domain.StorageTier;
import com.strata.domain.TierDefinition;
import com.strata.domain.TierTemplate;
import com.strata.support.MutableClock;
import com.strata.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TierTemplateRepository Tests")
class TierTemplateRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-11-10T00:00:00Z");

    private TestDatabase database;
    private MutableClock clock;
    private TierTemplateRepository repository;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        clock = new MutableClock(NOW);
        repository = new TierTemplateRepository(database.jdbcTemplate(),
            new ObjectMapper().registerModule(new JavaTimeModule()), clock);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    @DisplayName("Should store a template as a JSON document and read it back by name")
    void shouldRoundTripTemplate() {
        // Given
        repository.save(standard("Monthly hot, yearly warm and cold"));

        // When
        TierTemplate stored = repository.findByName("standard").orElseThrow();

        // Then
        assertThat(stored.getDescription()).isEqualTo("Monthly hot, yearly warm and cold");
        assertThat(stored.getHot().getGranularity()).isEqualTo(Granularity.MONTHLY);
        assertThat(stored.getWarm().getAgeMonths()).isEqualTo(36);
        assertThat(stored.getCold().getCodec()).isEqualTo("ARCHIVE_HIGH");
        assertThat(stored.tierForLocation("TS_WARM")).contains(StorageTier.WARM);
        assertThat(stored.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should replace a template with the same name and keep its creation time")
    void shouldReplaceByName() {
        // Given
        repository.save(standard("first"));
        TierTemplate original = repository.findByName("standard").orElseThrow();
        clock.advance(Duration.ofDays(1));

        // When
        original.setDescription("second");
        repository.save(original);

        // Then
        assertThat(repository.findAll()).hasSize(1);
        TierTemplate stored = repository.findByName("standard").orElseThrow();
        assertThat(stored.getDescription()).isEqualTo("second");
        assertThat(stored.getCreatedAt()).isEqualTo(NOW);
        assertThat(stored.getUpdatedAt()).isEqualTo(NOW.plus(Duration.ofDays(1)));
    }

    @Test
    @DisplayName("Should return nothing for unknown or missing names")
    void shouldHandleUnknownNames() {
        assertThat(repository.findByName("nope")).isEmpty();
        assertThat(repository.findByName(null)).isEmpty();
    }

    private static TierTemplate standard(String description) {
        return TierTemplate.builder()
            .name("standard")
            .description(description)
            .hot(TierDefinition.builder().ageMonths(12).granularity(Granularity.MONTHLY).location("TS_HOT").codec("NONE").build())
            .warm(TierDefinition.builder().ageMonths(36).granularity(Granularity.YEARLY).location("TS_WARM").codec("QUERY_HIGH").build())
            .cold(TierDefinition.builder().ageMonths(84).granularity(Granularity.YEARLY).location("TS_COLD").codec("ARCHIVE_HIGH").build())
            .build();
    }
}
