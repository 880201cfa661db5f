package com.strata.policy;

import com.strata.domain.ActionType;
import com.strata.domain.Dataset;
import com.strata.domain.Policy;
import com.strata.domain.TierDefinition;
import com.strata.domain.TierTemplate;
import com.strata.domain.ValidationCode;
import com.strata.domain.ValidationError;
import com.strata.storage.DatasetRepository;
import com.strata.storage.PolicyRepository;
import com.strata.storage.ThresholdProfileRepository;
import com.strata.storage.TierTemplateRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Write-time validation of policies: the policy's own shape plus everything it references.
 * Returns one error per defect.
 */
@Component
public class PolicyValidator {

    private final DatasetRepository datasetRepository;
    private final PolicyRepository policyRepository;
    private final ThresholdProfileRepository profileRepository;
    private final TierTemplateRepository templateRepository;
    private final CustomConditionEvaluator conditionEvaluator;

    public PolicyValidator(DatasetRepository datasetRepository,
                           PolicyRepository policyRepository,
                           ThresholdProfileRepository profileRepository,
                           TierTemplateRepository templateRepository,
                           CustomConditionEvaluator conditionEvaluator) {
        this.datasetRepository = datasetRepository;
        this.policyRepository = policyRepository;
        this.profileRepository = profileRepository;
        this.templateRepository = templateRepository;
        this.conditionEvaluator = conditionEvaluator;
    }

    public List<ValidationError> validate(Policy policy) {
        List<ValidationError> errors = new ArrayList<>(policy.shapeErrors());

        if (policy.getName() != null && !policy.getName().isBlank()) {
            Optional<Policy> sameName = policyRepository.findByName(policy.getName());
            if (sameName.isPresent() && !Objects.equals(sameName.get().getId(), policy.getId())) {
                errors.add(new ValidationError("name", ValidationCode.NAME_NOT_UNIQUE,
                    "A policy named " + policy.getName() + " already exists"));
            }
        }

        Optional<Dataset> dataset = Optional.empty();
        if (policy.getDatasetId() != null && !policy.getDatasetId().isBlank()) {
            dataset = datasetRepository.findById(policy.getDatasetId());
            if (dataset.isEmpty()) {
                errors.add(new ValidationError("dataset_id", ValidationCode.DATASET_NOT_FOUND,
                    "Dataset " + policy.getDatasetId() + " is not registered"));
            }
        }

        if (policy.getThresholdProfileId() != null
            && profileRepository.findById(policy.getThresholdProfileId()).isEmpty()) {
            errors.add(new ValidationError("threshold_profile_id", ValidationCode.PROFILE_NOT_FOUND,
                "Threshold profile " + policy.getThresholdProfileId() + " does not exist"));
        }

        String condition = policy.getCustomCondition();
        if (condition != null && !condition.isBlank()) {
            conditionEvaluator.check(condition).ifPresent(problem ->
                errors.add(new ValidationError("custom_condition", ValidationCode.CUSTOM_CONDITION_INVALID, problem)));
        }

        if (policy.getAction() == ActionType.MOVE && policy.getDestinationTier() != null && dataset.isPresent()) {
            checkDestinationTier(policy, dataset.get(), errors);
        }
        return errors;
    }

    /**
     * A MOVE must land on the location and codec its destination tier declares in the dataset's
     * template, so that the data classifies consistently afterwards.
     */
    private void checkDestinationTier(Policy policy, Dataset dataset, List<ValidationError> errors) {
        if (dataset.getTierTemplate() == null) {
            return;
        }
        Optional<TierTemplate> template = templateRepository.findByName(dataset.getTierTemplate());
        if (template.isEmpty()) {
            return;
        }
        TierDefinition tier = template.get().tier(policy.getDestinationTier());
        if (tier == null) {
            return;
        }
        if (policy.getLocation() != null && !policy.getLocation().equals(tier.getLocation())) {
            errors.add(new ValidationError("location", ValidationCode.TIER_MISMATCH,
                String.format("Location %s does not match tier %s of template %s (expected %s)",
                    policy.getLocation(), policy.getDestinationTier(), template.get().getName(), tier.getLocation())));
        }
        if (policy.getCodec() != null && !policy.getCodec().equals(tier.getCodec())) {
            errors.add(new ValidationError("codec", ValidationCode.TIER_MISMATCH,
                String.format("Codec %s does not match tier %s of template %s (expected %s)",
                    policy.getCodec(), policy.getDestinationTier(), template.get().getName(), tier.getCodec())));
        }
    }
}
