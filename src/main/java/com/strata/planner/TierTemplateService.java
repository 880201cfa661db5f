package com.strata.planner;

import com.strata.domain.ResourceNotFoundException;
import com.strata.domain.TierTemplate;
import com.strata.storage.TierTemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class TierTemplateService {

    private static final Logger log = LoggerFactory.getLogger(TierTemplateService.class);

    private final TierTemplateRepository repository;
    private final TierTemplateValidator validator;

    public TierTemplateService(TierTemplateRepository repository, TierTemplateValidator validator) {
        this.repository = repository;
        this.validator = validator;
    }

    /**
     * Creates or replaces a template.
     *
     * @throws TierTemplateValidationException with every defect when the template is incomplete
     */
    public TierTemplate save(TierTemplate template) {
        validator.validateOrThrow(template);
        repository.findByName(template.getName()).ifPresent(existing -> {
            template.setCreatedAt(existing.getCreatedAt());
            log.info("Replacing tier template {}", template.getName());
        });
        return repository.save(template);
    }

    public TierTemplate get(String name) {
        return repository.findByName(name)
            .orElseThrow(() -> new ResourceNotFoundException("tier template", name));
    }

    public List<TierTemplate> findAll() {
        return repository.findAll();
    }
}
