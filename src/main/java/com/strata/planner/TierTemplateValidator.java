package com.strata.planner;

import com.strata.domain.StorageTier;
import com.strata.domain.TierDefinition;
import com.strata.domain.TierTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.Period;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a tier template defines HOT, WARM and COLD completely, with strictly
 * ascending age thresholds. Every defect is reported separately.
 */
@Component
public class TierTemplateValidator {

    // Months and days thresholds are compared by their span ending at this date.
    private static final LocalDate COMPARISON_ANCHOR = LocalDate.of(2000, 1, 1);

    public List<TemplateError> validate(TierTemplate template) {
        List<TemplateError> errors = new ArrayList<>();
        if (template == null) {
            errors.add(new TemplateError(null, TemplateErrorCode.TEMPLATE_NAME_MISSING, "Template is missing"));
            return errors;
        }
        if (template.getName() == null || template.getName().isBlank()) {
            errors.add(new TemplateError(null, TemplateErrorCode.TEMPLATE_NAME_MISSING, "Template name is required"));
        }

        for (StorageTier tier : StorageTier.values()) {
            validateTier(tier, template.tier(tier), errors);
        }

        checkAscending(template, StorageTier.HOT, StorageTier.WARM, errors);
        checkAscending(template, StorageTier.WARM, StorageTier.COLD, errors);
        return errors;
    }

    /**
     * @throws TierTemplateValidationException when the template has any defect
     */
    public void validateOrThrow(TierTemplate template) {
        List<TemplateError> errors = validate(template);
        if (!errors.isEmpty()) {
            throw new TierTemplateValidationException(template != null ? template.getName() : null, errors);
        }
    }

    private void validateTier(StorageTier tier, TierDefinition definition, List<TemplateError> errors) {
        if (definition == null) {
            errors.add(new TemplateError(tier, TemplateErrorCode.TIER_MISSING,
                tier + " tier definition is missing"));
            return;
        }
        if (!definition.hasAgeThreshold()) {
            errors.add(new TemplateError(tier, TemplateErrorCode.AGE_THRESHOLD_MISSING,
                tier + " tier requires age_months or age_days"));
        } else if (spanDays(definition.getAgeThreshold()) <= 0) {
            errors.add(new TemplateError(tier, TemplateErrorCode.AGE_THRESHOLD_NOT_POSITIVE,
                tier + " tier age threshold must be positive"));
        }
        if (definition.getGranularity() == null) {
            errors.add(new TemplateError(tier, TemplateErrorCode.GRANULARITY_MISSING,
                tier + " tier requires a granularity"));
        }
        if (definition.getLocation() == null || definition.getLocation().isBlank()) {
            errors.add(new TemplateError(tier, TemplateErrorCode.LOCATION_MISSING,
                tier + " tier requires a storage location"));
        }
        if (definition.getCodec() == null || definition.getCodec().isBlank()) {
            errors.add(new TemplateError(tier, TemplateErrorCode.CODEC_MISSING,
                tier + " tier requires a compression codec"));
        }
    }

    private void checkAscending(TierTemplate template, StorageTier younger, StorageTier older,
                                List<TemplateError> errors) {
        TierDefinition first = template.tier(younger);
        TierDefinition second = template.tier(older);
        if (first == null || second == null || !first.hasAgeThreshold() || !second.hasAgeThreshold()) {
            return;
        }
        long firstDays = spanDays(first.getAgeThreshold());
        long secondDays = spanDays(second.getAgeThreshold());
        if (firstDays >= secondDays) {
            errors.add(new TemplateError(older, TemplateErrorCode.THRESHOLDS_NOT_ASCENDING,
                String.format("%s age threshold (%s) must be greater than %s age threshold (%s)",
                    older, second.getAgeThreshold(), younger, first.getAgeThreshold())));
        }
    }

    private static long spanDays(Period period) {
        return ChronoUnit.DAYS.between(COMPARISON_ANCHOR.minus(period), COMPARISON_ANCHOR);
    }
}
