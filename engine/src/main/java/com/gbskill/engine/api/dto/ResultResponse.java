package com.gbskill.engine.api.dto;

import com.gbskill.engine.benchmark.evaluation.AttributeScore;
import com.gbskill.engine.model.BenchmarkCase;
import com.gbskill.engine.model.BenchmarkResult;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * One case's outcome, with enough of the case to read it without a second call.
 */
public record ResultResponse(
        UUID                             id,
        String                           caseCode,
        String                           inputText,
        String                           difficulty,
        String                           expectedSkillId,
        String                           actualSkillId,
        Boolean                          skillMatch,
        Map<String, Map<String, Object>> expectedAttributes,
        Map<String, Object>              actualAttributes,
        Map<String, Object>              actualCategory,
        Map<String, AttributeScore>      attributeScores,
        double                           overallScore,
        Double                           actualConfidence,
        Long                             executionTimeMs,
        String                           traceId,
        String                           status,
        String                           errorMessage
) {
    public static ResultResponse from(BenchmarkResult r) {
        BenchmarkCase c = r.getBenchmarkCase();
        return new ResultResponse(
                r.getId(),
                c.getCaseCode(),
                c.getInputText(),
                c.getDifficulty().key(),
                c.getExpectedSkillId(),
                r.getActualSkillId(),
                r.getSkillMatch(),
                c.getExpectedAttributes(),
                r.getActualAttributes(),
                r.getActualCategory(),
                r.getAttributeScores(),
                r.getOverallScore(),
                r.getActualConfidence(),
                r.getExecutionTimeMs(),
                r.getTraceId(),
                r.getStatus().name().toLowerCase(Locale.ROOT),
                r.getErrorMessage()
        );
    }
}
