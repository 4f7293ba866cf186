package com.gbskill.engine.runtime;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gbskill.engine.dsl.CategoryMapping;
import com.gbskill.engine.dsl.CompiledSkill;
import com.gbskill.engine.model.ExecutionLog;
import com.gbskill.engine.model.ExecutionStatus;
import com.gbskill.engine.repository.ExecutionLogRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.gbskill.engine.runtime.ExecutionTracer.snapshot;

/**
 * Single-case entry point of the engine.
 *
 * <pre>
 *   input ─▶ IntentMatching ─▶ ExtractEngine ─▶ TableEngine ─▶ RuleEngine ─▶ CategoryEngine ─▶ StructBuilder
 *                  │
 *                  └─ no skill ─▶ DefaultParse
 * </pre>
 *
 * Stages run strictly in sequence and share nothing between calls, so
 * concurrent executions need no locking. Each call persists exactly one
 * {@link ExecutionLog}: a success log, or a failed log after which the
 * original exception is rethrown.
 */
@Service
public class SkillRuntime {

    private static final Logger log = LoggerFactory.getLogger(SkillRuntime.class);

    private final SkillLoader skillLoader;
    private final SkillSelector selector;
    private final AttributeExtractor extractor;
    private final TableDerivationEngine tableEngine;
    private final RuleEngine ruleEngine;
    private final CategoryMapper categoryMapper;
    private final StructBuilder structBuilder;
    private final ExecutionLogRepository executionLogRepository;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final double defaultConfidence;

    public SkillRuntime(SkillLoader skillLoader,
                        SkillSelector selector,
                        AttributeExtractor extractor,
                        TableDerivationEngine tableEngine,
                        RuleEngine ruleEngine,
                        CategoryMapper categoryMapper,
                        StructBuilder structBuilder,
                        ExecutionLogRepository executionLogRepository,
                        ObjectMapper objectMapper,
                        MeterRegistry meterRegistry,
                        @Value("${skillengine.runtime.default-confidence:0.3}") double defaultConfidence) {
        this.skillLoader = skillLoader;
        this.selector = selector;
        this.extractor = extractor;
        this.tableEngine = tableEngine;
        this.ruleEngine = ruleEngine;
        this.categoryMapper = categoryMapper;
        this.structBuilder = structBuilder;
        this.executionLogRepository = executionLogRepository;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.defaultConfidence = defaultConfidence;
    }

    public MaterialParseResponse execute(String inputText) {
        return execute(inputText, null);
    }

    /**
     * Parse one material description.
     *
     * @param traceId correlation id for the execution log; generated when null
     */
    public MaterialParseResponse execute(String inputText, String traceId) {
        String id = traceId != null ? traceId : newTraceId();
        ExecutionTracer tracer = new ExecutionTracer(id, meterRegistry);
        long startNanos = System.nanoTime();
        MDC.put("traceId", id);
        SkillMatch match = null;
        try {
            List<CompiledSkill> candidates = skillLoader.loadCandidates();
            match = tracer.trace("IntentMatching",
                    snapshot("inputText", inputText, "availableSkills", candidates.size()),
                    () -> selector.select(inputText, candidates),
                    m -> snapshot("matchedSkill", m.skillId(), "confidence", m.score(), "allScores", m.allScores()));

            MaterialParseResult result;
            if (match.matched()) {
                MDC.put("skillId", match.skillId());
                log.info("Matched skill '{}' (score {})", match.skillId(), match.score());
                result = executeSkill(inputText, match.skill(), tracer);
            } else {
                log.info("No skill matched; building default result");
                result = tracer.trace("DefaultParse", snapshot("inputText", inputText),
                        () -> structBuilder.buildDefault(inputText, defaultConfidence),
                        r -> snapshot("materialName", r.materialName(), "confidence", r.confidenceScore()));
            }

            long elapsed = elapsedMs(startNanos);
            ExecutionTrace trace = tracer.finish(elapsed);
            saveLog(id, inputText, match, result, trace, elapsed, null);
            countParse("success", match.matched());
            return new MaterialParseResponse(id, match.skillId(), match.score(), result, trace);

        } catch (RuntimeException e) {
            long elapsed = elapsedMs(startNanos);
            log.warn("Execution {} failed: {}", id, e.getMessage());
            try {
                saveLog(id, inputText, null, null, tracer.finish(elapsed), elapsed, e);
            } catch (RuntimeException logFailure) {
                e.addSuppressed(logFailure);
            }
            countParse("failed", match != null && match.matched());
            throw e;
        } finally {
            MDC.remove("skillId");
            MDC.remove("traceId");
        }
    }

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    private MaterialParseResult executeSkill(String inputText, CompiledSkill skill, ExecutionTracer tracer) {
        Map<String, ParsedAttribute> extracted = tracer.trace("ExtractEngine",
                snapshot("inputText", inputText),
                () -> extractor.extract(inputText, skill),
                attrs -> snapshot("attributes", attrs));

        TableDerivationEngine.Derivation derivation = tracer.trace("TableEngine",
                snapshot("tablesCount", skill.dsl().tablesOrEmpty().size(),
                        "dn", valueOf(extracted, StandardAttributes.NOMINAL_DIAMETER),
                        "pn", valueOf(extracted, StandardAttributes.NOMINAL_PRESSURE)),
                () -> tableEngine.derive(extracted, skill.dsl()),
                d -> snapshot("foundValues", d.found()));

        RuleEngine.RuleApplication rules = tracer.trace("RuleEngine",
                snapshot("rulesCount", skill.dsl().rulesOrEmpty().size()),
                () -> ruleEngine.apply(derivation.attributes(), skill.dsl()),
                r -> snapshot("appliedRules", r.applied()));

        CategoryMapping category = tracer.trace("CategoryEngine",
                snapshot(),
                () -> categoryMapper.map(skill.dsl()),
                c -> snapshot("category", c));

        return tracer.trace("StructBuilder",
                snapshot("attributeCount", rules.attributes().size()),
                () -> structBuilder.build(inputText, rules.attributes(), category, skill),
                r -> snapshot("materialName", r.materialName(), "confidence", r.confidenceScore(),
                        "needsReview", r.needsReview()));
    }

    // ------------------------------------------------------------------
    // Audit
    // ------------------------------------------------------------------

    private void saveLog(String traceId, String inputText, SkillMatch match, MaterialParseResult result,
                         ExecutionTrace trace, long elapsedMs, RuntimeException failure) {
        ExecutionLog entry = new ExecutionLog(traceId, inputText);
        if (match != null && match.matched()) {
            entry.setMatchedSkills(List.of(snapshot("skillId", match.skillId(), "score", match.score())));
            entry.setExecutedSkillId(match.skillId());
        }
        entry.setExecutionTrace(toMap(trace));
        if (result != null) {
            entry.setOutputResult(toMap(result));
            entry.setConfidenceScore(result.confidenceScore());
        }
        entry.setExecutionTimeMs(elapsedMs);
        if (failure != null) {
            entry.setStatus(ExecutionStatus.FAILED);
            entry.setErrorMessage(failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName());
        }
        executionLogRepository.save(entry);
    }

    private Map<String, Object> toMap(Object value) {
        return objectMapper.convertValue(value, new TypeReference<Map<String, Object>>() {});
    }

    private void countParse(String status, boolean matched) {
        meterRegistry.counter("skillengine.parse.calls",
                "status", status, "matched", String.valueOf(matched)).increment();
    }

    private static Object valueOf(Map<String, ParsedAttribute> attrs, String name) {
        ParsedAttribute a = attrs.get(name);
        return a == null ? null : a.value();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    static String newTraceId() {
        return "trace_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
