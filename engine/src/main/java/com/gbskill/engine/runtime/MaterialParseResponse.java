package com.gbskill.engine.runtime;

/**
 * Everything a single {@code execute} call returns.
 *
 * @param matchedSkillId null when no skill matched and the default result was built
 */
public record MaterialParseResponse(
        String              traceId,
        String              matchedSkillId,
        double              matchScore,
        MaterialParseResult result,
        ExecutionTrace      executionTrace) {}
