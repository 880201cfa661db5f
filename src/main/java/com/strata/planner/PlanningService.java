package com.strata.planner;

import com.strata.domain.Dataset;
import com.strata.domain.Partition;
import com.strata.domain.TierTemplate;
import com.strata.storage.DatasetRepository;
import com.strata.storage.StorageEngine;
import com.strata.storage.TierTemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Plans a registered dataset's initial layout with its tier template and optionally hands
 * the plan to the storage engine for creation.
 */
@Service
public class PlanningService {

    private static final Logger log = LoggerFactory.getLogger(PlanningService.class);

    private final TierBoundaryPlanner planner;
    private final DatasetRepository datasetRepository;
    private final TierTemplateRepository templateRepository;
    private final StorageEngine storageEngine;

    public PlanningService(
        TierBoundaryPlanner planner,
        DatasetRepository datasetRepository,
        TierTemplateRepository templateRepository,
        StorageEngine storageEngine
    ) {
        this.planner = planner;
        this.datasetRepository = datasetRepository;
        this.templateRepository = templateRepository;
        this.storageEngine = storageEngine;
    }

    public PartitionPlan plan(String datasetId, DateRange range, LocalDate referenceDate) {
        Dataset dataset = datasetRepository.findById(datasetId)
            .orElseThrow(() -> new PlanningException("Dataset is not registered", datasetId));
        if (dataset.getTierTemplate() == null) {
            throw new PlanningException("Dataset has no tier template", datasetId);
        }
        TierTemplate template = templateRepository.findByName(dataset.getTierTemplate())
            .orElseThrow(() -> new PlanningException("Tier template " + dataset.getTierTemplate() + " does not exist", datasetId));
        return planner.plan(datasetId, range, template, referenceDate);
    }

    /**
     * Plans and creates the partitions in one call. A failed plan creates nothing.
     */
    public List<Partition> planAndCreate(String datasetId, DateRange range, LocalDate referenceDate) {
        PartitionPlan plan = plan(datasetId, range, referenceDate);
        List<Partition> created = storageEngine.createPartitions(datasetId, plan.getPartitions());
        log.info("Created {} partitions for dataset {} (open interval continues at {} {})",
            created.size(), datasetId, plan.getAutoExtension().getStartingAt(), plan.getAutoExtension().getGranularity());
        return created;
    }
}
