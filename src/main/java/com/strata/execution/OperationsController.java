package com.strata.execution;

import com.strata.domain.ExecutionTrigger;
import com.strata.policy.EvaluationSummary;
import com.strata.policy.PolicyEvaluationEngine;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Operational controls of the engine.
 */
@RestController
@RequestMapping("/api/operations")
public class OperationsController {

    private final EngineConfigService configService;
    private final ExecutionEngine executionEngine;
    private final PolicyEvaluationEngine evaluationEngine;
    private final PartitionLockRegistry lockRegistry;

    public OperationsController(
        EngineConfigService configService,
        ExecutionEngine executionEngine,
        PolicyEvaluationEngine evaluationEngine,
        PartitionLockRegistry lockRegistry
    ) {
        this.configService = configService;
        this.executionEngine = executionEngine;
        this.evaluationEngine = evaluationEngine;
        this.lockRegistry = lockRegistry;
    }

    @GetMapping("/config")
    public EngineConfig getConfig() {
        return configService.current();
    }

    @PutMapping("/auto-execution")
    public EngineConfig setAutoExecution(@RequestParam boolean enabled) {
        return configService.setAutoExecution(enabled);
    }

    @PutMapping("/window")
    public EngineConfig setWindow(@RequestBody WindowRequest request) {
        return configService.setWindow(request.toWindow());
    }

    @PutMapping("/max-concurrent")
    public EngineConfig setMaxConcurrent(@RequestParam int value) {
        return configService.setMaxConcurrent(value);
    }

    /**
     * Running actions finish; nothing new is claimed until resumed.
     */
    @PostMapping("/stop")
    public EngineConfig stop() {
        return configService.requestStop();
    }

    @PostMapping("/resume")
    public EngineConfig resume() {
        return configService.resume();
    }

    @PostMapping("/evaluate")
    public EvaluationSummary evaluateNow() {
        return evaluationEngine.evaluateAll();
    }

    @PostMapping("/execute")
    public ExecutionSummary executeNow() {
        return executionEngine.executePending(ExecutionTrigger.MANUAL, null, null);
    }

    /**
     * Partitions currently busy and who holds them.
     */
    @GetMapping("/locks")
    public Map<String, String> listLocks() {
        return lockRegistry.snapshot();
    }
}
