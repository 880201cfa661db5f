package com.strata.planner;

import com.strata.domain.Granularity;
import com.strata.domain.StorageTier;
import com.strata.domain.TierDefinition;
import com.strata.domain.TierTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TierTemplateValidator Tests")
class TierTemplateValidatorTest {

    private TierTemplateValidator validator;

    @BeforeEach
    void setUp() {
        validator = new TierTemplateValidator();
    }

    @Test
    @DisplayName("Should accept a complete template mixing months and days")
    void shouldAcceptCompleteTemplate() {
        // Given
        TierTemplate template = TierTemplate.builder()
            .name("EVENTS")
            .hot(tier(null, 90, Granularity.DAILY))
            .warm(tier(12, null, Granularity.MONTHLY))
            .cold(tier(null, 1095, Granularity.YEARLY))
            .build();

        // When
        List<TemplateError> errors = validator.validate(template);

        // Then
        assertThat(errors).isEmpty();
    }

    @Test
    @DisplayName("Should report every missing field separately")
    void shouldReportEveryDefect() {
        // Given
        TierTemplate template = TierTemplate.builder()
            .name(" ")
            .hot(new TierDefinition())
            .warm(tier(36, null, Granularity.YEARLY))
            .build();

        // When
        List<TemplateError> errors = validator.validate(template);

        // Then
        assertThat(errors).extracting(TemplateError::getCode).containsExactlyInAnyOrder(
            TemplateErrorCode.TEMPLATE_NAME_MISSING,
            TemplateErrorCode.AGE_THRESHOLD_MISSING,
            TemplateErrorCode.GRANULARITY_MISSING,
            TemplateErrorCode.LOCATION_MISSING,
            TemplateErrorCode.CODEC_MISSING,
            TemplateErrorCode.TIER_MISSING);
        assertThat(errors).filteredOn(e -> e.getCode() == TemplateErrorCode.TIER_MISSING)
            .extracting(TemplateError::getTier).containsExactly(StorageTier.COLD);
    }

    @Test
    @DisplayName("Should require strictly ascending thresholds")
    void shouldRequireAscendingThresholds() {
        // Given
        TierTemplate template = TierTemplate.builder()
            .name("BROKEN")
            .hot(tier(12, null, Granularity.MONTHLY))
            .warm(tier(null, 365, Granularity.YEARLY))
            .cold(tier(84, null, Granularity.YEARLY))
            .build();

        // When / Then
        assertThatThrownBy(() -> validator.validateOrThrow(template))
            .isInstanceOfSatisfying(TierTemplateValidationException.class, e -> {
                assertThat(e.hasError(StorageTier.WARM, TemplateErrorCode.THRESHOLDS_NOT_ASCENDING)).isTrue();
                assertThat(e.getErrors()).hasSize(1);
            });
    }

    @Test
    @DisplayName("Should reject a zero threshold")
    void shouldRejectZeroThreshold() {
        // Given
        TierTemplate template = TierTemplate.builder()
            .name("ZERO")
            .hot(tier(0, null, Granularity.MONTHLY))
            .warm(tier(12, null, Granularity.YEARLY))
            .cold(tier(24, null, Granularity.YEARLY))
            .build();

        // When
        List<TemplateError> errors = validator.validate(template);

        // Then
        assertThat(errors).extracting(TemplateError::getCode)
            .containsExactly(TemplateErrorCode.AGE_THRESHOLD_NOT_POSITIVE);
    }

    private static TierDefinition tier(Integer months, Integer days, Granularity granularity) {
        return TierDefinition.builder()
            .ageMonths(months)
            .ageDays(days)
            .granularity(granularity)
            .location("TS_" + granularity.name())
            .codec("NONE")
            .build();
    }
}
