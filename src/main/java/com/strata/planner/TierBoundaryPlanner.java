package com.strata.planner;

import com.strata.domain.Granularity;
import com.strata.domain.PartitionSpec;
import com.strata.domain.StorageTier;
import com.strata.domain.TierDefinition;
import com.strata.domain.TierTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the initial partition layout of a dataset from its observed date range and a tier template.
 *
 * Tier cutoffs are measured back from the anchor, the end of the HOT interval that holds the
 * reference date (the observed maximum unless given). Each cutoff is aligned down to the
 * granularity of the tier that starts there:
 * <pre>
 *   COLD  [floor(min), warmStart)
 *   WARM  [warmStart,  hotStart)      warmStart = floor_warm(anchor - warm threshold)
 *   HOT   [hotStart,   anchor)        hotStart  = floor_hot(anchor - hot threshold)
 * </pre>
 * Within a tier boundaries advance by the tier's granularity; the last partition of a tier is
 * clipped to the next tier's start so the layout stays contiguous. Tiers the observed range
 * does not reach produce no partitions. The COLD threshold does not move any boundary; it marks
 * partitions lying entirely beyond it.
 */
@Component
public class TierBoundaryPlanner {

    private static final Logger logger = LoggerFactory.getLogger(TierBoundaryPlanner.class);

    private final TierTemplateValidator templateValidator;

    public TierBoundaryPlanner(TierTemplateValidator templateValidator) {
        this.templateValidator = templateValidator;
    }

    public PartitionPlan plan(String datasetId, DateRange range, TierTemplate template) {
        return plan(datasetId, range, template, range != null ? range.getMax() : null);
    }

    /**
     * Plans the partitions covering {@code range}.
     *
     * @param datasetId     dataset the plan is for
     * @param range         observed min and max of the partition column
     * @param template      tier template giving thresholds, granularities and locations
     * @param referenceDate date the tiers are measured back from; null or earlier than the range maximum means the maximum
     * @return partition specs in boundary order, the count past the COLD horizon and the HOT auto-extension
     * @throws PlanningException if the template is invalid or the range is empty; nothing is planned then
     */
    public PartitionPlan plan(String datasetId, DateRange range, TierTemplate template, LocalDate referenceDate) {
        try {
            templateValidator.validateOrThrow(template);
        } catch (TierTemplateValidationException e) {
            logger.error("Cannot plan dataset {}: {}", datasetId, e.getMessage());
            throw new PlanningException("Tier template is invalid", datasetId, e);
        }
        if (range == null || !range.isValid()) {
            throw new PlanningException("Observed date range is empty or inverted: " + range, datasetId);
        }
        if (referenceDate == null || referenceDate.isBefore(range.getMax())) {
            referenceDate = range.getMax();
        }

        TierDefinition hot = template.getHot();
        TierDefinition warm = template.getWarm();
        TierDefinition cold = template.getCold();

        LocalDate anchor = hot.getGranularity().next(hot.getGranularity().floor(referenceDate));
        LocalDate hotStart = hot.getGranularity().floor(hot.cutoffBefore(anchor));
        LocalDate warmStart = warm.getGranularity().floor(warm.cutoffBefore(anchor));
        if (warmStart.isAfter(hotStart)) {
            warmStart = hotStart;
        }
        LocalDate coldHorizon = cold.cutoffBefore(anchor);

        logger.debug("Planning dataset {} over {}: anchor={}, warmStart={}, hotStart={}, coldHorizon={}",
            datasetId, range, anchor, warmStart, hotStart, coldHorizon);

        List<PartitionSpec> partitions = new ArrayList<>();
        addTier(partitions, StorageTier.COLD, cold, null, warmStart, range, coldHorizon);
        addTier(partitions, StorageTier.WARM, warm, warmStart, hotStart, range, coldHorizon);
        addTier(partitions, StorageTier.HOT, hot, hotStart, anchor, range, coldHorizon);

        LocalDate openFrom = partitions.isEmpty() ? anchor : partitions.get(partitions.size() - 1).getUpper();
        PartitionPlan.AutoExtension extension = new PartitionPlan.AutoExtension(
            openFrom, hot.getGranularity(), hot.getLocation(), hot.getCodec());

        PartitionPlan plan = new PartitionPlan(datasetId, template.getName(), range, referenceDate, partitions, extension);
        logger.info("Planned {} partitions for dataset {} using template {}: {} ({} past COLD horizon)",
            partitions.size(), datasetId, template.getName(), plan.getCountsByTier(), plan.getPastColdHorizonCount());
        return plan;
    }

    private void addTier(List<PartitionSpec> partitions, StorageTier tier, TierDefinition definition,
                         LocalDate segmentStart, LocalDate segmentEnd, DateRange range, LocalDate coldHorizon) {
        Granularity granularity = definition.getGranularity();

        // Data starts after this tier's segment ends
        if (!range.getMin().isBefore(segmentEnd)) {
            return;
        }

        LocalDate start = granularity.floor(range.getMin());
        if (segmentStart != null && start.isBefore(segmentStart)) {
            start = segmentStart;
        }
        LocalDate end = granularity.next(granularity.floor(range.getMax()));
        if (end.isAfter(segmentEnd)) {
            end = segmentEnd;
        }

        LocalDate cursor = start;
        while (cursor.isBefore(end)) {
            LocalDate upper = granularity.next(cursor);
            if (upper.isAfter(end)) {
                upper = end;
            }
            boolean pastColdHorizon = !upper.isAfter(coldHorizon);
            partitions.add(new PartitionSpec(granularity.partitionName(cursor), cursor, upper, tier, granularity,
                definition.getLocation(), definition.getCodec(), pastColdHorizon));
            cursor = upper;
        }
    }
}
