package com.gbskill.engine.api.dto;

import com.gbskill.engine.model.ExecutionLog;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Stored audit record of one parse, as returned by GET /api/v1/material-parse/logs/{traceId}. */
public record ExecutionLogResponse(
        String                    traceId,
        String                    inputText,
        List<Map<String, Object>> matchedSkills,
        String                    executedSkillId,
        Map<String, Object>       executionTrace,
        Map<String, Object>       outputResult,
        Double                    confidenceScore,
        Long                      executionTimeMs,
        String                    status,
        String                    errorMessage,
        Instant                   createdAt
) {
    public static ExecutionLogResponse from(ExecutionLog e) {
        return new ExecutionLogResponse(
                e.getTraceId(),
                e.getInputText(),
                e.getMatchedSkills(),
                e.getExecutedSkillId(),
                e.getExecutionTrace(),
                e.getOutputResult(),
                e.getConfidenceScore(),
                e.getExecutionTimeMs(),
                e.getStatus().name().toLowerCase(Locale.ROOT),
                e.getErrorMessage(),
                e.getCreatedAt()
        );
    }
}
