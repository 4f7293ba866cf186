package com.gbskill.engine.benchmark;

import com.gbskill.engine.benchmark.evaluation.ExpectedAttribute;
import com.gbskill.engine.model.BenchmarkCase;
import com.gbskill.engine.model.BenchmarkDataset;
import com.gbskill.engine.model.BenchmarkRun;
import com.gbskill.engine.model.CaseDifficulty;
import com.gbskill.engine.model.CaseSourceType;
import com.gbskill.engine.model.DatasetSourceType;
import com.gbskill.engine.model.DatasetStatus;
import com.gbskill.engine.model.GenerationTemplate;
import com.gbskill.engine.model.Skill;
import com.gbskill.engine.repository.BenchmarkCaseRepository;
import com.gbskill.engine.repository.BenchmarkDatasetRepository;
import com.gbskill.engine.repository.BenchmarkRunRepository;
import com.gbskill.engine.repository.GenerationTemplateRepository;
import com.gbskill.engine.repository.SkillRepository;
import com.gbskill.engine.service.DuplicateResourceException;
import com.gbskill.engine.service.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Curation of datasets, their hand-written cases, and generation templates.
 */
@Service
public class BenchmarkDatasetService {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkDatasetService.class);

    private final BenchmarkDatasetRepository datasetRepository;
    private final BenchmarkCaseRepository caseRepository;
    private final BenchmarkRunRepository runRepository;
    private final GenerationTemplateRepository templateRepository;
    private final SkillRepository skillRepository;

    public BenchmarkDatasetService(BenchmarkDatasetRepository datasetRepository,
                                   BenchmarkCaseRepository caseRepository,
                                   BenchmarkRunRepository runRepository,
                                   GenerationTemplateRepository templateRepository,
                                   SkillRepository skillRepository) {
        this.datasetRepository = datasetRepository;
        this.caseRepository = caseRepository;
        this.runRepository = runRepository;
        this.templateRepository = templateRepository;
        this.skillRepository = skillRepository;
    }

    // ------------------------------------------------------------------
    // Datasets
    // ------------------------------------------------------------------

    /**
     * @param skillId optional skill the dataset targets
     * @throws DuplicateResourceException when the code is taken
     */
    @Transactional
    public BenchmarkDataset createDataset(String datasetCode, String datasetName, String description, String skillId) {
        if (datasetRepository.existsByDatasetCode(datasetCode)) {
            throw new DuplicateResourceException("BenchmarkDataset", datasetCode);
        }
        BenchmarkDataset dataset = new BenchmarkDataset(datasetCode, datasetName);
        dataset.setDescription(description);
        if (skillId != null && !skillId.isBlank()) {
            Skill skill = skillRepository.findBySkillId(skillId)
                    .orElseThrow(() -> new ResourceNotFoundException("Skill", skillId));
            dataset.setSkill(skill);
        }
        datasetRepository.save(dataset);
        log.info("Created dataset {}", datasetCode);
        return dataset;
    }

    @Transactional(readOnly = true)
    public BenchmarkDataset getDataset(UUID datasetId) {
        return datasetRepository.findById(datasetId)
                .orElseThrow(() -> new ResourceNotFoundException("BenchmarkDataset", datasetId));
    }

    /** Archived datasets accept no new cases or runs; existing runs stay readable. */
    @Transactional
    public BenchmarkDataset archiveDataset(UUID datasetId) {
        BenchmarkDataset dataset = getDataset(datasetId);
        dataset.setStatus(DatasetStatus.ARCHIVED);
        datasetRepository.save(dataset);
        log.info("Archived dataset {}", dataset.getDatasetCode());
        return dataset;
    }

    @Transactional(readOnly = true)
    public List<BenchmarkRun> listRuns(UUID datasetId) {
        getDataset(datasetId);
        return runRepository.findByDatasetIdOrderByCreatedAtDesc(datasetId);
    }

    // ------------------------------------------------------------------
    // Cases
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public List<BenchmarkCase> listCases(UUID datasetId, boolean activeOnly) {
        getDataset(datasetId);
        return activeOnly
                ? caseRepository.findByDatasetIdAndActiveTrueOrderByCreatedAtAscCaseCodeAsc(datasetId)
                : caseRepository.findByDatasetIdOrderByCreatedAtAscCaseCodeAsc(datasetId);
    }

    /**
     * Add a seed case and count it in the dataset's difficulty distribution.
     *
     * @throws BenchmarkException DATASET_ARCHIVED
     */
    @Transactional
    public BenchmarkCase addCase(UUID datasetId, NewCase draft) {
        if (draft.inputText() == null || draft.inputText().isBlank()) {
            throw new IllegalArgumentException("inputText must not be blank");
        }
        BenchmarkDataset dataset = getDataset(datasetId);
        if (dataset.getStatus() == DatasetStatus.ARCHIVED) {
            throw new BenchmarkException(BenchmarkException.Kind.DATASET_ARCHIVED,
                    "Dataset " + dataset.getDatasetCode() + " is archived");
        }
        CaseDifficulty difficulty = draft.difficulty() != null ? draft.difficulty() : CaseDifficulty.MEDIUM;

        BenchmarkCase c = new BenchmarkCase(dataset, Codes.caseCode("CASE"), draft.inputText().strip());
        c.setExpectedSkillId(draft.expectedSkillId());
        c.setExpectedAttributes(normalizeExpected(draft.expectedAttributes()));
        c.setExpectedCategory(draft.expectedCategory());
        c.setDifficulty(difficulty);
        c.setSourceType(CaseSourceType.SEED);
        if (draft.tags() != null) c.setTags(new ArrayList<>(draft.tags()));
        caseRepository.save(c);

        Map<String, Integer> dist = new LinkedHashMap<>(
                dataset.getDifficultyDistribution() == null ? Map.of() : dataset.getDifficultyDistribution());
        dist.merge(difficulty.key(), 1, Integer::sum);
        dataset.setDifficultyDistribution(dist);
        dataset.setTotalCases(dataset.getTotalCases() + 1);
        if (dataset.getSourceType() == DatasetSourceType.GENERATED) {
            dataset.setSourceType(DatasetSourceType.MIXED);
        }
        if (dataset.getStatus() == DatasetStatus.DRAFT) {
            dataset.setStatus(DatasetStatus.READY);
        }
        datasetRepository.save(dataset);
        return c;
    }

    /** Bare values become {@code {value}} so every stored expectation has the same shape. */
    static Map<String, Map<String, Object>> normalizeExpected(Map<String, Object> raw) {
        Map<String, Map<String, Object>> expected = new LinkedHashMap<>();
        if (raw == null) return expected;
        raw.forEach((name, v) -> expected.put(name, ExpectedAttribute.from(v).toMap()));
        return expected;
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    /**
     * @throws DuplicateResourceException when the code is taken
     */
    @Transactional
    public GenerationTemplate createTemplate(String templateCode, String templateName, String domain,
                                             String pattern, List<String> variants,
                                             Map<String, Object> noiseRules, String description) {
        if (templateRepository.existsByTemplateCode(templateCode)) {
            throw new DuplicateResourceException("GenerationTemplate", templateCode);
        }
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must not be blank");
        }
        GenerationTemplate template = new GenerationTemplate(templateCode, templateName, pattern);
        template.setDomain(domain);
        template.setVariants(variants != null ? new ArrayList<>(variants) : new ArrayList<>());
        template.setNoiseRules(noiseRules);
        template.setDescription(description);
        templateRepository.save(template);
        log.info("Created template {}", templateCode);
        return template;
    }

    @Transactional(readOnly = true)
    public List<GenerationTemplate> listActiveTemplates() {
        return templateRepository.findByActiveTrueOrderByTemplateCodeAsc();
    }
}
