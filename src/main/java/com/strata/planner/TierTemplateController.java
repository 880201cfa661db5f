package com.strata.planner;

import com.strata.domain.TierTemplate;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tier-templates")
public class TierTemplateController {

    private final TierTemplateService templateService;

    public TierTemplateController(TierTemplateService templateService) {
        this.templateService = templateService;
    }

    @GetMapping
    public List<TierTemplate> listTemplates() {
        return templateService.findAll();
    }

    @GetMapping("/{name}")
    public TierTemplate getTemplate(@PathVariable String name) {
        return templateService.get(name);
    }

    @PutMapping("/{name}")
    public TierTemplate saveTemplate(@PathVariable String name, @RequestBody TierTemplate template) {
        template.setName(name);
        return templateService.save(template);
    }
}
