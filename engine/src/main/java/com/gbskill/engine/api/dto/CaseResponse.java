package com.gbskill.engine.api.dto;

import com.gbskill.engine.model.BenchmarkCase;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

public record CaseResponse(
        UUID                             id,
        String                           caseCode,
        String                           inputText,
        String                           expectedSkillId,
        Map<String, Map<String, Object>> expectedAttributes,
        Map<String, Object>              expectedCategory,
        String                           difficulty,
        String                           sourceType,
        String                           sourceReference,
        List<String>                     tags,
        boolean                          active,
        Instant                          createdAt
) {
    public static CaseResponse from(BenchmarkCase c) {
        return new CaseResponse(
                c.getId(),
                c.getCaseCode(),
                c.getInputText(),
                c.getExpectedSkillId(),
                c.getExpectedAttributes(),
                c.getExpectedCategory(),
                c.getDifficulty().key(),
                c.getSourceType().name().toLowerCase(Locale.ROOT),
                c.getSourceReference(),
                c.getTags(),
                c.isActive(),
                c.getCreatedAt()
        );
    }
}
