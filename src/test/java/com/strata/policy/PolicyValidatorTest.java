package com.strata.policy;

import com.strata.domain.ActionType;
import com.strata.domain.Dataset;
import com.strata.domain.Granularity;
import com.strata.domain.Policy;
import com.strata.domain.StorageTier;
import com.strata.domain.TierDefinition;
import com.strata.domain.TierTemplate;
import com.strata.domain.ValidationCode;
import com.strata.domain.ValidationError;
import com.strata.storage.DatasetRepository;
import com.strata.storage.PolicyRepository;
import com.strata.storage.ThresholdProfileRepository;
import com.strata.storage.TierTemplateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PolicyValidator Tests")
class PolicyValidatorTest {

    @Mock
    private DatasetRepository datasetRepository;

    @Mock
    private PolicyRepository policyRepository;

    @Mock
    private ThresholdProfileRepository profileRepository;

    @Mock
    private TierTemplateRepository templateRepository;

    private PolicyValidator validator;

    @BeforeEach
    void setUp() {
        validator = new PolicyValidator(datasetRepository, policyRepository, profileRepository,
            templateRepository, new SpelCustomConditionEvaluator());
    }

    @Test
    @DisplayName("Should accept a complete MOVE policy consistent with its template")
    void shouldAcceptValidPolicy() {
        // Given
        Policy policy = movePolicy().build();
        when(policyRepository.findByName("hot-to-warm")).thenReturn(Optional.empty());
        when(datasetRepository.findById("sales")).thenReturn(Optional.of(new Dataset("sales", "FACT")));
        when(templateRepository.findByName("FACT")).thenReturn(Optional.of(template()));

        // When
        List<ValidationError> errors = validator.validate(policy);

        // Then
        assertThat(errors).isEmpty();
    }

    @Test
    @DisplayName("Should report each structural defect once")
    void shouldReportShapeErrors() {
        // Given
        Policy policy = Policy.builder().priority(0).action(ActionType.MOVE).build();

        // When
        List<ValidationError> errors = validator.validate(policy);

        // Then
        assertThat(errors).extracting(ValidationError::getCode).containsExactlyInAnyOrder(
            ValidationCode.NAME_REQUIRED,
            ValidationCode.DATASET_REQUIRED,
            ValidationCode.PRIORITY_OUT_OF_RANGE,
            ValidationCode.NO_TRIGGER_CONDITION,
            ValidationCode.CODEC_REQUIRED,
            ValidationCode.LOCATION_REQUIRED,
            ValidationCode.DESTINATION_TIER_REQUIRED);
        verifyNoInteractions(datasetRepository, policyRepository);
    }

    @Test
    @DisplayName("Should reject the merge action on a policy")
    void shouldRejectMergeAction() {
        // Given
        Policy policy = movePolicy().action(ActionType.MERGE).build();
        when(policyRepository.findByName(anyString())).thenReturn(Optional.empty());
        when(datasetRepository.findById("sales")).thenReturn(Optional.of(new Dataset("sales", null)));

        // When
        List<ValidationError> errors = validator.validate(policy);

        // Then
        assertThat(errors).extracting(ValidationError::getCode).containsExactly(ValidationCode.ACTION_NOT_ALLOWED);
    }

    @Test
    @DisplayName("Should report missing references and duplicate names")
    void shouldReportReferenceErrors() {
        // Given
        Policy policy = movePolicy().id(5L).thresholdProfileId(42L).customCondition("rowCount >").build();
        when(policyRepository.findByName("hot-to-warm"))
            .thenReturn(Optional.of(movePolicy().id(7L).build()));
        when(datasetRepository.findById("sales")).thenReturn(Optional.empty());
        when(profileRepository.findById(42L)).thenReturn(Optional.empty());

        // When
        List<ValidationError> errors = validator.validate(policy);

        // Then
        assertThat(errors).extracting(ValidationError::getCode).containsExactlyInAnyOrder(
            ValidationCode.NAME_NOT_UNIQUE,
            ValidationCode.DATASET_NOT_FOUND,
            ValidationCode.PROFILE_NOT_FOUND,
            ValidationCode.CUSTOM_CONDITION_INVALID);
    }

    @Test
    @DisplayName("Should reject a MOVE whose location disagrees with the destination tier")
    void shouldRejectTierMismatch() {
        // Given
        Policy policy = movePolicy().location("TS_COLD").build();
        when(policyRepository.findByName("hot-to-warm")).thenReturn(Optional.empty());
        when(datasetRepository.findById("sales")).thenReturn(Optional.of(new Dataset("sales", "FACT")));
        when(templateRepository.findByName("FACT")).thenReturn(Optional.of(template()));

        // When
        List<ValidationError> errors = validator.validate(policy);

        // Then
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getCode()).isEqualTo(ValidationCode.TIER_MISMATCH);
        assertThat(errors.get(0).getField()).isEqualTo("location");
    }

    private static Policy.Builder movePolicy() {
        return Policy.builder()
            .name("hot-to-warm")
            .datasetId("sales")
            .ageMonths(12)
            .action(ActionType.MOVE)
            .destinationTier(StorageTier.WARM)
            .location("TS_WARM")
            .codec("QUERY_HIGH");
    }

    private static TierTemplate template() {
        return TierTemplate.builder()
            .name("FACT")
            .hot(TierDefinition.builder().ageMonths(12).granularity(Granularity.MONTHLY).location("TS_HOT").codec("NONE").build())
            .warm(TierDefinition.builder().ageMonths(36).granularity(Granularity.YEARLY).location("TS_WARM").codec("QUERY_HIGH").build())
            .cold(TierDefinition.builder().ageMonths(84).granularity(Granularity.YEARLY).location("TS_COLD").codec("ARCHIVE_HIGH").build())
            .build();
    }
}
