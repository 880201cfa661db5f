package com.strata.merge;

import com.strata.domain.DeferredMerge;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/merges")
public class MergeController {

    private final PartitionMergeScheduler mergeScheduler;

    public MergeController(PartitionMergeScheduler mergeScheduler) {
        this.mergeScheduler = mergeScheduler;
    }

    @GetMapping("/backlog")
    public List<DeferredMerge> listBacklog() {
        return mergeScheduler.backlog();
    }

    @PostMapping("/retry")
    public Map<String, Integer> retryBacklog() {
        return Map.of("merged", mergeScheduler.retryBacklog());
    }
}
