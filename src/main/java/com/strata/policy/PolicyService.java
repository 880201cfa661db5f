package com.strata.policy;

import com.strata.domain.Policy;
import com.strata.domain.ResourceNotFoundException;
import com.strata.domain.ValidationError;
import com.strata.domain.ValidationException;
import com.strata.storage.PolicyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Policy definition writes and the pause/resume control.
 */
@Service
public class PolicyService {

    private static final Logger log = LoggerFactory.getLogger(PolicyService.class);

    private final PolicyRepository repository;
    private final PolicyValidator validator;
    private final ThresholdResolver thresholdResolver;

    public PolicyService(PolicyRepository repository, PolicyValidator validator, ThresholdResolver thresholdResolver) {
        this.repository = repository;
        this.validator = validator;
        this.thresholdResolver = thresholdResolver;
    }

    /**
     * @throws ValidationException listing every defect, nothing is stored in that case
     */
    public Policy create(Policy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Policy must not be null");
        }
        policy.setId(null);
        policy.setVersion(1);
        rejectIfInvalid(policy);
        return repository.insert(policy);
    }

    /**
     * Replaces the definition and bumps the version, which lifts any terminal-failure
     * block recorded against the previous version.
     */
    public Policy update(Long policyId, Policy changes) {
        if (changes == null) {
            throw new IllegalArgumentException("Policy must not be null");
        }
        Policy existing = get(policyId);
        changes.setId(existing.getId());
        changes.setCreatedAt(existing.getCreatedAt());
        changes.setVersion(existing.getVersion() + 1);
        rejectIfInvalid(changes);
        return repository.update(changes);
    }

    public Policy setEnabled(Long policyId, boolean enabled) {
        Policy policy = get(policyId);
        repository.setEnabled(policyId, enabled);
        policy.setEnabled(enabled);
        log.info("Policy {} {}", policy.getName(), enabled ? "resumed" : "paused");
        return policy;
    }

    public Policy get(Long policyId) {
        return repository.findById(policyId)
            .orElseThrow(() -> new ResourceNotFoundException("policy", policyId));
    }

    public List<Policy> findAll() {
        return repository.findAll();
    }

    public EffectiveThresholds effectiveThresholds(Long policyId) {
        return thresholdResolver.effectiveThresholds(get(policyId));
    }

    public List<EffectiveThresholds> effectiveThresholds() {
        return repository.findAll().stream()
            .map(thresholdResolver::effectiveThresholds)
            .collect(Collectors.toList());
    }

    private void rejectIfInvalid(Policy policy) {
        List<ValidationError> errors = validator.validate(policy);
        if (!errors.isEmpty()) {
            log.warn("Rejected policy {}: {}", policy.getName(), errors);
            throw new ValidationException("policy " + policy.getName(), errors);
        }
    }
}
