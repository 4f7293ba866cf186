package com.gbskill.engine.api;

import com.gbskill.engine.api.dto.AddCaseRequest;
import com.gbskill.engine.api.dto.CaseResponse;
import com.gbskill.engine.api.dto.CreateDatasetRequest;
import com.gbskill.engine.api.dto.CreateTemplateRequest;
import com.gbskill.engine.api.dto.DatasetResponse;
import com.gbskill.engine.api.dto.Difficulties;
import com.gbskill.engine.api.dto.GenerateRequest;
import com.gbskill.engine.api.dto.PreviewRequest;
import com.gbskill.engine.api.dto.RunResponse;
import com.gbskill.engine.api.dto.TemplateGenerateRequest;
import com.gbskill.engine.api.dto.TemplateResponse;
import com.gbskill.engine.benchmark.BenchmarkDataGenerator;
import com.gbskill.engine.benchmark.BenchmarkDatasetService;
import com.gbskill.engine.benchmark.GenerationResult;
import com.gbskill.engine.model.BenchmarkDataset;
import com.gbskill.engine.model.CaseDifficulty;
import com.gbskill.engine.model.GenerationTemplate;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Benchmark datasets, cases and generation.
 *
 * POST /api/v1/benchmark/datasets                               : create a dataset
 * GET  /api/v1/benchmark/datasets/{id}                          : dataset summary
 * POST /api/v1/benchmark/datasets/{id}/archive                  : freeze it
 * GET  /api/v1/benchmark/datasets/{id}/cases                    : its cases
 * POST /api/v1/benchmark/datasets/{id}/cases                    : add a hand-written case
 * GET  /api/v1/benchmark/datasets/{id}/runs                     : its runs, newest first
 * POST /api/v1/benchmark/datasets/{id}/generate                 : generate cases from a skill
 * POST /api/v1/benchmark/datasets/{id}/generate-from-template   : generate cases from a template
 * GET  /api/v1/benchmark/templates                              : active templates
 * POST /api/v1/benchmark/templates                              : create a template
 * POST /api/v1/benchmark/templates/{id}/preview                 : render samples, store nothing
 */
@RestController
@RequestMapping("/api/v1/benchmark")
public class BenchmarkController {

    private final BenchmarkDatasetService datasetService;
    private final BenchmarkDataGenerator  generator;

    public BenchmarkController(BenchmarkDatasetService datasetService, BenchmarkDataGenerator generator) {
        this.datasetService = datasetService;
        this.generator      = generator;
    }

    // ------------------------------------------------------------------
    // Datasets and cases
    // ------------------------------------------------------------------

    @PostMapping("/datasets")
    public ResponseEntity<DatasetResponse> createDataset(@Valid @RequestBody CreateDatasetRequest req) {
        BenchmarkDataset dataset = datasetService.createDataset(
                req.datasetCode(), req.datasetName(), req.description(), req.skillId());
        return ResponseEntity.status(HttpStatus.CREATED).body(DatasetResponse.from(dataset));
    }

    @GetMapping("/datasets/{id}")
    public DatasetResponse getDataset(@PathVariable UUID id) {
        return DatasetResponse.from(datasetService.getDataset(id));
    }

    @PostMapping("/datasets/{id}/archive")
    public DatasetResponse archiveDataset(@PathVariable UUID id) {
        return DatasetResponse.from(datasetService.archiveDataset(id));
    }

    @GetMapping("/datasets/{id}/cases")
    public List<CaseResponse> listCases(@PathVariable UUID id,
                                        @RequestParam(defaultValue = "false") boolean activeOnly) {
        return datasetService.listCases(id, activeOnly).stream()
                .map(CaseResponse::from)
                .toList();
    }

    @PostMapping("/datasets/{id}/cases")
    public ResponseEntity<CaseResponse> addCase(@PathVariable UUID id, @Valid @RequestBody AddCaseRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CaseResponse.from(datasetService.addCase(id, req.toNewCase())));
    }

    @GetMapping("/datasets/{id}/runs")
    public List<RunResponse> listRuns(@PathVariable UUID id) {
        return datasetService.listRuns(id).stream()
                .map(RunResponse::from)
                .toList();
    }

    // ------------------------------------------------------------------
    // Generation
    // ------------------------------------------------------------------

    @PostMapping("/datasets/{id}/generate")
    public GenerationResult generate(@PathVariable UUID id, @Valid @RequestBody GenerateRequest req) {
        return generator.generateFromSkill(id, req.toOptions());
    }

    @PostMapping("/datasets/{id}/generate-from-template")
    public GenerationResult generateFromTemplate(@PathVariable UUID id,
                                                 @Valid @RequestBody TemplateGenerateRequest req) {
        CaseDifficulty difficulty = Difficulties.parseOrDefault(req.difficulty(), CaseDifficulty.MEDIUM);
        return generator.generateFromTemplate(id, req.templateId(), req.values(), req.count(), difficulty);
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    @GetMapping("/templates")
    public List<TemplateResponse> listTemplates() {
        return datasetService.listActiveTemplates().stream()
                .map(TemplateResponse::from)
                .toList();
    }

    @PostMapping("/templates")
    public ResponseEntity<TemplateResponse> createTemplate(@Valid @RequestBody CreateTemplateRequest req) {
        GenerationTemplate template = datasetService.createTemplate(req.templateCode(), req.templateName(),
                req.domain(), req.pattern(), req.variants(), req.noiseRules(), req.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(TemplateResponse.from(template));
    }

    @PostMapping("/templates/{id}/preview")
    public Map<String, Object> previewTemplate(@PathVariable UUID id, @Valid @RequestBody PreviewRequest req) {
        CaseDifficulty difficulty = Difficulties.parseOrDefault(req.difficulty(), CaseDifficulty.MEDIUM);
        List<String> samples = generator.previewTemplate(id, req.values(), req.count(), difficulty);
        return Map.of("templateId", id, "samples", samples);
    }
}
