package com.strata.scheduling;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.domain.ThresholdProfile;
import com.strata.domain.TierTemplate;
import com.strata.planner.TierTemplateService;
import com.strata.policy.ThresholdProfileService;
import com.strata.policy.ThresholdResolver;
import com.strata.storage.ThresholdProfileRepository;
import com.strata.storage.TierTemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Seeds the built-in threshold profiles and tier templates on startup.
 * Existing rows with the same name are left as they are.
 */
@Component
@ConditionalOnProperty(name = "strata.seed.enabled", havingValue = "true", matchIfMissing = true)
public class SeedDataLoader implements ApplicationRunner {
    private static final Logger logger = LoggerFactory.getLogger(SeedDataLoader.class);

    static final String PROFILES_RESOURCE = "seed/threshold-profiles.json";
    static final String TEMPLATES_RESOURCE = "seed/tier-templates.json";

    private final ObjectMapper objectMapper;
    private final ThresholdProfileRepository profileRepository;
    private final ThresholdProfileService profileService;
    private final ThresholdResolver thresholdResolver;
    private final TierTemplateRepository templateRepository;
    private final TierTemplateService templateService;

    public SeedDataLoader(ObjectMapper objectMapper,
                          ThresholdProfileRepository profileRepository,
                          ThresholdProfileService profileService,
                          ThresholdResolver thresholdResolver,
                          TierTemplateRepository templateRepository,
                          TierTemplateService templateService) {
        this.objectMapper = objectMapper;
        this.profileRepository = profileRepository;
        this.profileService = profileService;
        this.thresholdResolver = thresholdResolver;
        this.templateRepository = templateRepository;
        this.templateService = templateService;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<ThresholdProfile> profiles = new ArrayList<>();
        profiles.add(thresholdResolver.configuredDefault().toBuilder().build());
        profiles.addAll(read(PROFILES_RESOURCE, new TypeReference<List<ThresholdProfile>>() { }));
        int seededProfiles = 0;
        for (ThresholdProfile profile : profiles) {
            if (profileRepository.findByName(profile.getName()).isEmpty()) {
                profileService.create(profile);
                seededProfiles++;
            }
        }

        int seededTemplates = 0;
        for (TierTemplate template : read(TEMPLATES_RESOURCE, new TypeReference<List<TierTemplate>>() { })) {
            if (templateRepository.findByName(template.getName()).isEmpty()) {
                templateService.save(template);
                seededTemplates++;
            }
        }
        logger.info("Seeded {} threshold profiles and {} tier templates", seededProfiles, seededTemplates);
    }

    private <T> List<T> read(String resource, TypeReference<List<T>> type) throws IOException {
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            return objectMapper.readValue(in, type);
        }
    }
}
