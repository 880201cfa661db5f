package com.strata.planner;

import com.strata.domain.Dataset;
import com.strata.domain.ExecutionTrigger;
import com.strata.domain.Partition;
import com.strata.execution.ExecutionEngine;
import com.strata.execution.ExecutionSummary;
import com.strata.policy.EvaluationSummary;
import com.strata.policy.PolicyEvaluationEngine;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Dataset registry, initial layout planning and the per-dataset manual triggers.
 */
@RestController
@RequestMapping("/api/datasets")
public class DatasetController {

    private final DatasetService datasetService;
    private final PlanningService planningService;
    private final PolicyEvaluationEngine evaluationEngine;
    private final ExecutionEngine executionEngine;
    private final Clock clock;

    public DatasetController(
        DatasetService datasetService,
        PlanningService planningService,
        PolicyEvaluationEngine evaluationEngine,
        ExecutionEngine executionEngine,
        Clock clock
    ) {
        this.datasetService = datasetService;
        this.planningService = planningService;
        this.evaluationEngine = evaluationEngine;
        this.executionEngine = executionEngine;
        this.clock = clock;
    }

    @GetMapping
    public List<Dataset> listDatasets() {
        return datasetService.findAll();
    }

    @GetMapping("/{datasetId}")
    public Dataset getDataset(@PathVariable String datasetId) {
        return datasetService.get(datasetId);
    }

    @PostMapping
    public ResponseEntity<Dataset> registerDataset(@RequestBody Dataset dataset) {
        return ResponseEntity.status(HttpStatus.CREATED).body(datasetService.register(dataset));
    }

    /**
     * Plans the layout for the observed date range without creating anything.
     */
    @PostMapping("/{datasetId}/plan")
    public PartitionPlan planDataset(
        @PathVariable String datasetId,
        @RequestBody DateRange range,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate referenceDate
    ) {
        return planningService.plan(datasetId, range, referenceDate != null ? referenceDate : LocalDate.now(clock));
    }

    @PostMapping("/{datasetId}/partitions")
    public ResponseEntity<List<Partition>> createPartitions(
        @PathVariable String datasetId,
        @RequestBody DateRange range,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate referenceDate
    ) {
        List<Partition> created = planningService.planAndCreate(datasetId, range,
            referenceDate != null ? referenceDate : LocalDate.now(clock));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PostMapping("/{datasetId}/evaluate")
    public EvaluationSummary evaluateDataset(@PathVariable String datasetId) {
        datasetService.get(datasetId);
        return evaluationEngine.evaluateDataset(datasetId);
    }

    @PostMapping("/{datasetId}/execute")
    public ExecutionSummary executeDataset(@PathVariable String datasetId) {
        datasetService.get(datasetId);
        return executionEngine.executePending(ExecutionTrigger.MANUAL, null, datasetId);
    }
}
