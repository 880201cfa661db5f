package com.strata.classifier;

import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/datasets/{datasetId}/temperatures")
public class TemperatureController {

    private final TemperatureRefreshService refreshService;

    public TemperatureController(TemperatureRefreshService refreshService) {
        this.refreshService = refreshService;
    }

    @GetMapping
    public List<TemperatureView> listTemperatures(@PathVariable String datasetId) {
        return refreshService.temperatures(datasetId);
    }

    @PostMapping("/refresh")
    public Map<String, Integer> refreshTemperatures(@PathVariable String datasetId) {
        return Map.of("refreshed", refreshService.refreshDataset(datasetId));
    }
}
