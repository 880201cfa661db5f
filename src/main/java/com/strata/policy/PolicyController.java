package com.strata.policy;

import com.strata.domain.ExecutionTrigger;
import com.strata.domain.Policy;
import com.strata.execution.ExecutionEngine;
import com.strata.execution.ExecutionSummary;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Policy definitions, pause/resume and the per-policy manual triggers.
 */
@RestController
@RequestMapping("/api/policies")
public class PolicyController {

    private final PolicyService policyService;
    private final PolicyEvaluationEngine evaluationEngine;
    private final ExecutionEngine executionEngine;

    public PolicyController(
        PolicyService policyService,
        PolicyEvaluationEngine evaluationEngine,
        ExecutionEngine executionEngine
    ) {
        this.policyService = policyService;
        this.evaluationEngine = evaluationEngine;
        this.executionEngine = executionEngine;
    }

    @GetMapping
    public List<Policy> listPolicies() {
        return policyService.findAll();
    }

    @GetMapping("/{policyId}")
    public Policy getPolicy(@PathVariable Long policyId) {
        return policyService.get(policyId);
    }

    @PostMapping
    public ResponseEntity<Policy> createPolicy(@RequestBody Policy policy) {
        return ResponseEntity.status(HttpStatus.CREATED).body(policyService.create(policy));
    }

    @PutMapping("/{policyId}")
    public Policy updatePolicy(@PathVariable Long policyId, @RequestBody Policy policy) {
        return policyService.update(policyId, policy);
    }

    @PostMapping("/{policyId}/pause")
    public Policy pausePolicy(@PathVariable Long policyId) {
        return policyService.setEnabled(policyId, false);
    }

    @PostMapping("/{policyId}/resume")
    public Policy resumePolicy(@PathVariable Long policyId) {
        return policyService.setEnabled(policyId, true);
    }

    @GetMapping("/effective-thresholds")
    public List<EffectiveThresholds> listEffectiveThresholds() {
        return policyService.effectiveThresholds();
    }

    @GetMapping("/{policyId}/effective-thresholds")
    public EffectiveThresholds getEffectiveThresholds(@PathVariable Long policyId) {
        return policyService.effectiveThresholds(policyId);
    }

    @PostMapping("/{policyId}/evaluate")
    public EvaluationSummary evaluatePolicy(@PathVariable Long policyId) {
        return evaluationEngine.evaluatePolicy(policyId);
    }

    /**
     * Executes the policy's pending entries now, still within the execution window and
     * concurrency limit.
     */
    @PostMapping("/{policyId}/execute")
    public ExecutionSummary executePolicy(@PathVariable Long policyId) {
        policyService.get(policyId);
        return executionEngine.executePending(ExecutionTrigger.MANUAL, policyId, null);
    }
}
