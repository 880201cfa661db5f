package com.strata.policy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.strata.domain.Policy;
import com.strata.domain.ThresholdProfile;
import com.strata.storage.ThresholdProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Resolves the threshold profile a policy is classified with: the policy's own profile when it
 * references one, otherwise the global default.
 *
 * The default is the stored profile named {@value ThresholdProfile#DEFAULT_NAME}; until one is
 * stored, it is built from {@code strata.thresholds.default.*}.
 */
@Component
public class ThresholdResolver {

    private static final Logger log = LoggerFactory.getLogger(ThresholdResolver.class);

    private static final long CACHE_TTL_SECONDS = 60;
    private static final int CACHE_MAX_SIZE = 1_000;

    private final ThresholdProfileRepository repository;
    private final ThresholdProfile configuredDefault;
    private final Cache<String, ThresholdProfile> profiles;

    public ThresholdResolver(ThresholdProfileRepository repository,
                             @Value("${strata.thresholds.default.hot-days:90}") int hotDays,
                             @Value("${strata.thresholds.default.warm-days:365}") int warmDays,
                             @Value("${strata.thresholds.default.cold-days:1095}") int coldDays) {
        this.repository = repository;
        this.configuredDefault = ThresholdProfile.builder()
            .name(ThresholdProfile.DEFAULT_NAME)
            .hotDays(hotDays)
            .warmDays(warmDays)
            .coldDays(coldDays)
            .description("Global default thresholds")
            .build();
        this.profiles = Caffeine.newBuilder()
            .maximumSize(CACHE_MAX_SIZE)
            .expireAfterWrite(CACHE_TTL_SECONDS, TimeUnit.SECONDS)
            .build();
        log.info("Global default thresholds {}", configuredDefault);
    }

    public ThresholdProfile defaultProfile() {
        ThresholdProfile stored = profiles.get("name:" + ThresholdProfile.DEFAULT_NAME,
            key -> repository.findByName(ThresholdProfile.DEFAULT_NAME).orElse(null));
        return stored != null ? stored : configuredDefault;
    }

    /**
     * Default profile as configured, ignoring any stored override.
     */
    public ThresholdProfile configuredDefault() {
        return configuredDefault;
    }

    public ThresholdProfile resolve(Policy policy) {
        return resolveWithSource(policy).profile;
    }

    public EffectiveThresholds effectiveThresholds(Policy policy) {
        Resolution resolution = resolveWithSource(policy);
        return new EffectiveThresholds(policy.getId(), policy.getName(), resolution.profile, resolution.source);
    }

    public void invalidate() {
        profiles.invalidateAll();
    }

    private Resolution resolveWithSource(Policy policy) {
        Long profileId = policy.getThresholdProfileId();
        if (profileId != null) {
            Optional<ThresholdProfile> own = Optional.ofNullable(
                profiles.get("id:" + profileId, key -> repository.findById(profileId).orElse(null)));
            if (own.isPresent()) {
                return new Resolution(own.get(), EffectiveThresholds.Source.POLICY_PROFILE);
            }
            log.warn("Policy {} references missing threshold profile {}, using the global default",
                policy.getName(), profileId);
        }
        return new Resolution(defaultProfile(), EffectiveThresholds.Source.GLOBAL_DEFAULT);
    }

    private static final class Resolution {
        private final ThresholdProfile profile;
        private final EffectiveThresholds.Source source;

        private Resolution(ThresholdProfile profile, EffectiveThresholds.Source source) {
            this.profile = profile;
            this.source = source;
        }
    }
}
