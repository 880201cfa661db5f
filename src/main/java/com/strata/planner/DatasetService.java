package com.strata.planner;

import com.strata.domain.Dataset;
import com.strata.domain.ResourceNotFoundException;
import com.strata.domain.ValidationCode;
import com.strata.domain.ValidationError;
import com.strata.domain.ValidationException;
import com.strata.storage.DatasetRepository;
import com.strata.storage.TierTemplateRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry of datasets under lifecycle management.
 */
@Service
public class DatasetService {

    private final DatasetRepository datasetRepository;
    private final TierTemplateRepository templateRepository;

    public DatasetService(DatasetRepository datasetRepository, TierTemplateRepository templateRepository) {
        this.datasetRepository = datasetRepository;
        this.templateRepository = templateRepository;
    }

    /**
     * Registers a dataset, or updates it when the id is already registered.
     *
     * @throws ValidationException when the id is missing or the tier template does not exist
     */
    public Dataset register(Dataset dataset) {
        List<ValidationError> errors = new ArrayList<>();
        if (dataset.getId() == null || dataset.getId().isBlank()) {
            errors.add(new ValidationError("dataset_id", ValidationCode.ID_REQUIRED, "Dataset id is required"));
        }
        if (dataset.getTierTemplate() != null && templateRepository.findByName(dataset.getTierTemplate()).isEmpty()) {
            errors.add(new ValidationError("tier_template", ValidationCode.TEMPLATE_NOT_FOUND,
                "Tier template " + dataset.getTierTemplate() + " does not exist"));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("dataset " + dataset.getId(), errors);
        }
        if (dataset.getDisplayName() == null) {
            dataset.setDisplayName(dataset.getId());
        }
        return datasetRepository.save(dataset);
    }

    public Dataset get(String datasetId) {
        return datasetRepository.findById(datasetId)
            .orElseThrow(() -> new ResourceNotFoundException("dataset", datasetId));
    }

    public List<Dataset> findAll() {
        return datasetRepository.findAll();
    }
}
