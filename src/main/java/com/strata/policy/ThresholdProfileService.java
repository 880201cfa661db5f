package com.strata.policy;

import com.strata.domain.ResourceNotFoundException;
import com.strata.domain.ThresholdProfile;
import com.strata.domain.ValidationCode;
import com.strata.domain.ValidationError;
import com.strata.domain.ValidationException;
import com.strata.storage.PolicyRepository;
import com.strata.storage.ThresholdProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Threshold profile writes. Every write is validated before it reaches the store, so a
 * non-ascending profile is never persisted.
 */
@Service
public class ThresholdProfileService {

    private static final Logger log = LoggerFactory.getLogger(ThresholdProfileService.class);

    private final ThresholdProfileRepository repository;
    private final PolicyRepository policyRepository;
    private final ThresholdResolver resolver;

    public ThresholdProfileService(ThresholdProfileRepository repository, PolicyRepository policyRepository,
                                   ThresholdResolver resolver) {
        this.repository = repository;
        this.policyRepository = policyRepository;
        this.resolver = resolver;
    }

    public ThresholdProfile create(ThresholdProfile profile) {
        validate(profile, null);
        ThresholdProfile created = repository.insert(profile);
        resolver.invalidate();
        return created;
    }

    public ThresholdProfile update(Long profileId, ThresholdProfile changes) {
        ThresholdProfile existing = get(profileId);
        changes.setId(existing.getId());
        changes.setCreatedAt(existing.getCreatedAt());
        validate(changes, profileId);
        ThresholdProfile updated = repository.update(changes);
        resolver.invalidate();
        return updated;
    }

    /**
     * Refuses to delete a profile that a policy still references.
     */
    public void delete(Long profileId) {
        ThresholdProfile existing = get(profileId);
        int references = policyRepository.countByThresholdProfile(profileId);
        if (references > 0) {
            throw new ValidationException("threshold profile " + existing.getName(),
                new ValidationError("profile_id", ValidationCode.PROFILE_IN_USE,
                    String.format("Profile %s is referenced by %d polic%s", existing.getName(), references,
                        references == 1 ? "y" : "ies")));
        }
        repository.delete(profileId);
        resolver.invalidate();
    }

    public ThresholdProfile get(Long profileId) {
        return repository.findById(profileId)
            .orElseThrow(() -> new ResourceNotFoundException("threshold profile", profileId));
    }

    public List<ThresholdProfile> findAll() {
        return repository.findAll();
    }

    private void validate(ThresholdProfile profile, Long selfId) {
        if (profile == null) {
            throw new IllegalArgumentException("Threshold profile must not be null");
        }
        List<ValidationError> errors = new ArrayList<>(profile.validationErrors());
        if (profile.getName() != null && !profile.getName().isBlank()) {
            Optional<ThresholdProfile> sameName = repository.findByName(profile.getName());
            if (sameName.isPresent() && !sameName.get().getId().equals(selfId)) {
                errors.add(new ValidationError("name", ValidationCode.NAME_NOT_UNIQUE,
                    "A threshold profile named " + profile.getName() + " already exists"));
            }
        }
        if (!errors.isEmpty()) {
            log.warn("Rejected threshold profile {}: {}", profile.getName(), errors);
            throw new ValidationException("threshold profile " + profile.getName(), errors);
        }
    }
}
