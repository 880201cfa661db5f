package com.strata.monitoring;

import com.strata.domain.ExecutionLogEntry;
import com.strata.domain.ExecutionStatus;
import com.strata.domain.ResourceNotFoundException;
import com.strata.storage.ExecutionLogQuery;
import com.strata.storage.ExecutionLogRepository;
import com.strata.storage.PolicyExecutionStats;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Audit log and per-policy execution statistics.
 */
@RestController
@RequestMapping("/api/executions")
public class ExecutionLogController {

    private final ExecutionLogRepository logRepository;

    public ExecutionLogController(ExecutionLogRepository logRepository) {
        this.logRepository = logRepository;
    }

    @GetMapping
    public List<ExecutionLogEntry> findExecutions(
        @RequestParam(required = false) String datasetId,
        @RequestParam(required = false) Long policyId,
        @RequestParam(required = false) ExecutionStatus status,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
        @RequestParam(defaultValue = "100") int limit
    ) {
        return logRepository.find(ExecutionLogQuery.all()
            .dataset(datasetId)
            .policy(policyId)
            .status(status)
            .from(from)
            .to(to)
            .limit(limit));
    }

    @GetMapping("/{executionId}")
    public ExecutionLogEntry getExecution(@PathVariable Long executionId) {
        return logRepository.findById(executionId)
            .orElseThrow(() -> new ResourceNotFoundException("execution", executionId));
    }

    @GetMapping("/statistics")
    public List<PolicyExecutionStats> getStatistics() {
        return logRepository.statistics();
    }
}
