package com.gbskill.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.gbskill.engine.model.Skill;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Catalog view of a skill. The stored DSL is embedded as-is so its key order
 * survives.
 */
public record SkillResponse(
        UUID    id,
        String  skillId,
        String  skillName,
        String  domain,
        int     priority,
        String  status,
        String  dslVersion,
        String  standardCode,
        @JsonRawValue String dsl,
        Instant createdAt,
        Instant updatedAt
) {
    public static SkillResponse from(Skill s) {
        return new SkillResponse(
                s.getId(),
                s.getSkillId(),
                s.getSkillName(),
                s.getDomain(),
                s.getPriority(),
                s.getStatus().name().toLowerCase(Locale.ROOT),
                s.getDslVersion(),
                s.getStandardCode(),
                s.getDslContent(),
                s.getCreatedAt(),
                s.getUpdatedAt()
        );
    }
}
