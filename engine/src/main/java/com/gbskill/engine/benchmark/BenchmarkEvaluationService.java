package com.gbskill.engine.benchmark;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gbskill.engine.benchmark.evaluation.AttributeMatcher;
import com.gbskill.engine.benchmark.evaluation.BenchmarkMetrics;
import com.gbskill.engine.benchmark.evaluation.EvaluationConfig;
import com.gbskill.engine.benchmark.evaluation.MetricsCalculator;
import com.gbskill.engine.model.BenchmarkCase;
import com.gbskill.engine.model.BenchmarkDataset;
import com.gbskill.engine.model.BenchmarkResult;
import com.gbskill.engine.model.BenchmarkRun;
import com.gbskill.engine.model.CaseDifficulty;
import com.gbskill.engine.model.DatasetStatus;
import com.gbskill.engine.model.ResultStatus;
import com.gbskill.engine.model.RunStatus;
import com.gbskill.engine.repository.BenchmarkCaseRepository;
import com.gbskill.engine.repository.BenchmarkDatasetRepository;
import com.gbskill.engine.repository.BenchmarkResultRepository;
import com.gbskill.engine.repository.BenchmarkRunRepository;
import com.gbskill.engine.runtime.MaterialParseResponse;
import com.gbskill.engine.runtime.MaterialParseResult;
import com.gbskill.engine.runtime.SkillRuntime;
import com.gbskill.engine.service.ResourceNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Creates benchmark runs and drives them through every active case of their dataset.
 *
 * Lifecycle of a run:
 * <pre>
 *   PENDING ──execute──▶ RUNNING ──▶ COMPLETED
 *                           │
 *                           └──(run-level failure)──▶ FAILED
 * </pre>
 *
 * Cases are evaluated one at a time in dataset order. A case that throws
 * becomes an ERROR result and the loop moves on; only failures outside the
 * per-case boundary (persistence, metrics) fail the run. Progress is
 * checkpointed every {@code skillengine.benchmark.batch-size} cases.
 *
 * {@link #executeRun} runs outside a transaction; each result and each
 * checkpoint commits on its own.
 */
@Service
public class BenchmarkEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkEvaluationService.class);

    private static final DateTimeFormatter RUN_NAME_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    static final double SUCCESS_THRESHOLD = 0.9;
    static final double PARTIAL_THRESHOLD = 0.5;

    private final BenchmarkDatasetRepository datasetRepository;
    private final BenchmarkCaseRepository caseRepository;
    private final BenchmarkRunRepository runRepository;
    private final BenchmarkResultRepository resultRepository;
    private final SkillRuntime runtime;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final int batchSize;

    public BenchmarkEvaluationService(BenchmarkDatasetRepository datasetRepository,
                                      BenchmarkCaseRepository caseRepository,
                                      BenchmarkRunRepository runRepository,
                                      BenchmarkResultRepository resultRepository,
                                      SkillRuntime runtime,
                                      ObjectMapper objectMapper,
                                      MeterRegistry meterRegistry,
                                      @Value("${skillengine.benchmark.batch-size:10}") int batchSize) {
        this.datasetRepository = datasetRepository;
        this.caseRepository = caseRepository;
        this.runRepository = runRepository;
        this.resultRepository = resultRepository;
        this.runtime = runtime;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.batchSize = Math.max(1, batchSize);
    }

    // ------------------------------------------------------------------
    // Create
    // ------------------------------------------------------------------

    /**
     * Register a PENDING run over a dataset.
     *
     * @throws ResourceNotFoundException if the dataset does not exist
     * @throws BenchmarkException        DATASET_ARCHIVED, or DATASET_EMPTY when it has no active case
     */
    @Transactional
    public BenchmarkRun createRun(UUID datasetId, String runName, String description, EvaluationConfig config) {
        BenchmarkDataset dataset = datasetRepository.findById(datasetId)
                .orElseThrow(() -> new ResourceNotFoundException("BenchmarkDataset", datasetId));
        if (dataset.getStatus() == DatasetStatus.ARCHIVED) {
            throw new BenchmarkException(BenchmarkException.Kind.DATASET_ARCHIVED,
                    "Dataset " + dataset.getDatasetCode() + " is archived");
        }
        long activeCases = caseRepository.countByDatasetIdAndActiveTrue(datasetId);
        if (activeCases == 0) {
            throw new BenchmarkException(BenchmarkException.Kind.DATASET_EMPTY,
                    "Dataset " + dataset.getDatasetCode() + " has no active cases");
        }

        BenchmarkRun run = new BenchmarkRun(Codes.runCode(), dataset,
                config != null ? config : EvaluationConfig.defaults());
        run.setRunName(runName != null && !runName.isBlank()
                ? runName
                : "Benchmark Run " + LocalDateTime.now().format(RUN_NAME_TIME));
        run.setDescription(description);
        run.setTotalCases((int) activeCases);
        runRepository.save(run);

        log.info("Created run {} over dataset {} ({} cases)", run.getRunCode(), dataset.getDatasetCode(), activeCases);
        return run;
    }

    // ------------------------------------------------------------------
    // Execute
    // ------------------------------------------------------------------

    /**
     * Evaluate every active case of the run's dataset.
     *
     * A COMPLETED run is returned as is, without new results.
     *
     * @throws BenchmarkException RUN_ALREADY_IN_PROGRESS while another call is executing it,
     *                            RUN_FAILED for a run that already failed
     */
    public BenchmarkRun executeRun(UUID runId) {
        BenchmarkRun run = runRepository.findById(runId)
                .orElseThrow(() -> new ResourceNotFoundException("BenchmarkRun", runId));

        switch (run.getStatus()) {
            case COMPLETED -> {
                return run;
            }
            case RUNNING -> throw new BenchmarkException(BenchmarkException.Kind.RUN_ALREADY_IN_PROGRESS,
                    "Run " + run.getRunCode() + " is already running");
            case FAILED -> throw new BenchmarkException(BenchmarkException.Kind.RUN_FAILED,
                    "Run " + run.getRunCode() + " failed: " + run.getErrorMessage());
            default -> { }
        }

        run.setStatus(RunStatus.RUNNING);
        run.setStartedAt(Instant.now());
        runRepository.saveAndFlush(run);

        MDC.put("runId", run.getRunCode());
        try {
            List<BenchmarkCase> cases =
                    caseRepository.findByDatasetIdAndActiveTrueOrderByCreatedAtAscCaseCodeAsc(run.getDataset().getId());
            run.setTotalCases(cases.size());
            log.info("Run {} started: {} cases", run.getRunCode(), cases.size());

            AttributeMatcher matcher = new AttributeMatcher(run.getConfig());
            int completed = 0;
            for (BenchmarkCase benchmarkCase : cases) {
                MDC.put("caseId", benchmarkCase.getCaseCode());
                BenchmarkResult result = evaluateCase(run, benchmarkCase, matcher);
                resultRepository.save(result);
                meterRegistry.counter("skillengine.benchmark.results",
                        "status", result.getStatus().name().toLowerCase(Locale.ROOT)).increment();
                completed++;
                if (completed % batchSize == 0) {
                    run.setCompletedCases(completed);
                    runRepository.save(run);
                    log.debug("Run {} checkpoint: {}/{}", run.getRunCode(), completed, cases.size());
                }
            }
            MDC.remove("caseId");

            BenchmarkMetrics metrics = MetricsCalculator.calculate(resultRepository.findWithCaseByRunId(runId));
            run.setCompletedCases(completed);
            run.setMetrics(metrics);
            run.setStatus(RunStatus.COMPLETED);
            run.setCompletedAt(Instant.now());
            runRepository.save(run);

            log.info("Run {} completed: accuracy={} avgScore={}", run.getRunCode(),
                    metrics.overall().accuracy(), metrics.overall().avgScore());
            return run;

        } catch (RuntimeException e) {
            run.setStatus(RunStatus.FAILED);
            run.setErrorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            run.setCompletedAt(Instant.now());
            try {
                runRepository.save(run);
            } catch (RuntimeException saveFailure) {
                e.addSuppressed(saveFailure);
            }
            log.error("Run {} failed after {} cases", run.getRunCode(), run.getCompletedCases(), e);
            throw e;
        } finally {
            MDC.remove("caseId");
            MDC.remove("runId");
        }
    }

    /** Runs one case through the engine and scores it; any failure becomes an ERROR result. */
    BenchmarkResult evaluateCase(BenchmarkRun run, BenchmarkCase benchmarkCase, AttributeMatcher matcher) {
        String traceId = "bench_" + run.getRunCode() + "_" + benchmarkCase.getCaseCode() + "_" + hex8();
        long startNanos = System.nanoTime();
        try {
            MaterialParseResponse response = runtime.execute(benchmarkCase.getInputText(), traceId);
            MaterialParseResult parsed = response.result();

            BenchmarkResult result = new BenchmarkResult(run, benchmarkCase, ResultStatus.FAILED);
            result.setTraceId(response.traceId());
            result.setActualSkillId(response.matchedSkillId());
            result.setActualAttributes(toMap(parsed.attributes()));
            result.setActualCategory(parsed.category() != null ? toMap(parsed.category()) : null);
            result.setActualConfidence(parsed.confidenceScore());

            Boolean skillMatch = null;
            if (!run.getConfig().skipSkillMatch() && benchmarkCase.getExpectedSkillId() != null) {
                skillMatch = Objects.equals(benchmarkCase.getExpectedSkillId(), response.matchedSkillId());
            }
            result.setSkillMatch(skillMatch);

            AttributeMatcher.CaseScore score =
                    matcher.matchAll(expectedOf(benchmarkCase), result.getActualAttributes());
            result.setAttributeScores(score.scores());
            result.setOverallScore(score.overallScore());
            result.setStatus(statusFor(skillMatch, score.overallScore()));
            result.setExecutionTimeMs(elapsedMs(startNanos));
            return result;

        } catch (RuntimeException e) {
            log.warn("Case {} failed: {}", benchmarkCase.getCaseCode(), e.getMessage());
            BenchmarkResult result = new BenchmarkResult(run, benchmarkCase, ResultStatus.ERROR);
            result.setTraceId(traceId);
            result.setErrorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            result.setExecutionTimeMs(elapsedMs(startNanos));
            return result;
        }
    }

    static ResultStatus statusFor(Boolean skillMatch, double overallScore) {
        if (Boolean.FALSE.equals(skillMatch)) return ResultStatus.FAILED;
        if (overallScore >= SUCCESS_THRESHOLD) return ResultStatus.SUCCESS;
        if (overallScore >= PARTIAL_THRESHOLD) return ResultStatus.PARTIAL;
        return ResultStatus.FAILED;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public BenchmarkRun getRun(UUID runId) {
        return runRepository.findById(runId)
                .orElseThrow(() -> new ResourceNotFoundException("BenchmarkRun", runId));
    }

    /**
     * @throws BenchmarkException RUN_NOT_COMPLETED until the run has completed
     */
    @Transactional(readOnly = true)
    public BenchmarkMetrics getRunMetrics(UUID runId) {
        BenchmarkRun run = getRun(runId);
        if (run.getStatus() != RunStatus.COMPLETED) {
            throw new BenchmarkException(BenchmarkException.Kind.RUN_NOT_COMPLETED,
                    "Run " + run.getRunCode() + " is " + run.getStatus());
        }
        return run.getMetrics();
    }

    /**
     * Results of a run in evaluation order.
     *
     * @param statuses     keep only these statuses; empty or null keeps all
     * @param difficulties keep only cases of these difficulties; empty or null keeps all
     */
    @Transactional(readOnly = true)
    public List<BenchmarkResult> getRunResults(UUID runId,
                                               Collection<ResultStatus> statuses,
                                               Collection<CaseDifficulty> difficulties) {
        getRun(runId);
        List<BenchmarkResult> results = statuses == null || statuses.isEmpty()
                ? resultRepository.findWithCaseByRunId(runId)
                : resultRepository.findWithCaseByRunIdAndStatusIn(runId, statuses);
        if (difficulties == null || difficulties.isEmpty()) {
            return results;
        }
        return results.stream()
                .filter(r -> difficulties.contains(r.getBenchmarkCase().getDifficulty()))
                .toList();
    }

    /** FAILED and ERROR results, each with its case loaded. */
    @Transactional(readOnly = true)
    public List<BenchmarkResult> getFailedCases(UUID runId) {
        getRun(runId);
        return resultRepository.findWithCaseByRunIdAndStatusIn(runId,
                List.of(ResultStatus.FAILED, ResultStatus.ERROR));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Map<String, Map<String, Object>> expectedOf(BenchmarkCase benchmarkCase) {
        return benchmarkCase.getExpectedAttributes() != null ? benchmarkCase.getExpectedAttributes() : Map.of();
    }

    private Map<String, Object> toMap(Object value) {
        return objectMapper.convertValue(value, new TypeReference<Map<String, Object>>() {});
    }

    private static String hex8() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
