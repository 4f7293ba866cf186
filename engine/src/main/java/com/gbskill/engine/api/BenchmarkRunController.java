package com.gbskill.engine.api;

import com.gbskill.engine.api.dto.CreateRunRequest;
import com.gbskill.engine.api.dto.Difficulties;
import com.gbskill.engine.api.dto.ResultResponse;
import com.gbskill.engine.api.dto.RunResponse;
import com.gbskill.engine.benchmark.BenchmarkEvaluationService;
import com.gbskill.engine.benchmark.evaluation.BenchmarkMetrics;
import com.gbskill.engine.model.BenchmarkRun;
import com.gbskill.engine.model.ResultStatus;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Benchmark runs.
 *
 * POST /api/v1/benchmark/runs                     : create a PENDING run over a dataset
 * GET  /api/v1/benchmark/runs/{id}                : poll status and progress
 * POST /api/v1/benchmark/runs/{id}/execute        : evaluate every active case (synchronous)
 * GET  /api/v1/benchmark/runs/{id}/metrics        : aggregate metrics; 409 until completed
 * GET  /api/v1/benchmark/runs/{id}/results        : per-case results, filterable
 * GET  /api/v1/benchmark/runs/{id}/failed-cases   : failed and errored cases
 */
@RestController
@RequestMapping("/api/v1/benchmark/runs")
public class BenchmarkRunController {

    private final BenchmarkEvaluationService evaluationService;

    public BenchmarkRunController(BenchmarkEvaluationService evaluationService) {
        this.evaluationService = evaluationService;
    }

    @PostMapping
    public ResponseEntity<RunResponse> create(@Valid @RequestBody CreateRunRequest req) {
        BenchmarkRun run = evaluationService.createRun(req.datasetId(), req.runName(), req.description(), req.config());
        return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
    }

    @GetMapping("/{id}")
    public RunResponse get(@PathVariable UUID id) {
        return RunResponse.from(evaluationService.getRun(id));
    }

    @PostMapping("/{id}/execute")
    public RunResponse execute(@PathVariable UUID id) {
        return RunResponse.from(evaluationService.executeRun(id));
    }

    @GetMapping("/{id}/metrics")
    public BenchmarkMetrics metrics(@PathVariable UUID id) {
        return evaluationService.getRunMetrics(id);
    }

    /**
     * Optional filters, each repeatable or comma-separated:
     *   status     : success, partial, failed, error
     *   difficulty : easy, medium, hard, adversarial
     */
    @GetMapping("/{id}/results")
    public List<ResultResponse> results(@PathVariable UUID id,
                                        @RequestParam(required = false) List<String> status,
                                        @RequestParam(required = false) List<String> difficulty) {
        return evaluationService.getRunResults(id, parseStatuses(status), Difficulties.parseAll(difficulty))
                .stream()
                .map(ResultResponse::from)
                .toList();
    }

    @GetMapping("/{id}/failed-cases")
    public List<ResultResponse> failedCases(@PathVariable UUID id) {
        return evaluationService.getFailedCases(id).stream()
                .map(ResultResponse::from)
                .toList();
    }

    private static List<ResultStatus> parseStatuses(List<String> raw) {
        List<ResultStatus> statuses = new ArrayList<>();
        if (raw == null) return statuses;
        for (String s : raw) {
            try {
                statuses.add(ResultStatus.valueOf(s.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown result status: " + s);
            }
        }
        return statuses;
    }
}
