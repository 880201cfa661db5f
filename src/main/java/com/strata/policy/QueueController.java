package com.strata.policy;

import com.strata.domain.EvaluationQueueEntry;
import com.strata.domain.QueueStatus;
import com.strata.storage.EvaluationQueueRepository;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Evaluation queue inspection and the operator reset.
 */
@RestController
@RequestMapping("/api/queue")
public class QueueController {

    private final EvaluationQueueRepository queueRepository;

    public QueueController(EvaluationQueueRepository queueRepository) {
        this.queueRepository = queueRepository;
    }

    @GetMapping
    public List<EvaluationQueueEntry> listEntries(
        @RequestParam(required = false) QueueStatus status,
        @RequestParam(defaultValue = "100") int limit
    ) {
        return queueRepository.findAll(status, limit);
    }

    /**
     * Eligible PENDING entries in the order they will be claimed.
     */
    @GetMapping("/upcoming")
    public List<EvaluationQueueEntry> listUpcoming(@RequestParam(defaultValue = "20") int limit) {
        return queueRepository.findUpcoming(limit);
    }

    @DeleteMapping
    public Map<String, Integer> clearQueue() {
        return Map.of("deleted", queueRepository.clear());
    }
}
