package com.gbskill.engine.api.dto;

import com.gbskill.engine.model.BenchmarkDataset;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

public record DatasetResponse(
        UUID                 id,
        String               datasetCode,
        String               datasetName,
        String               description,
        String               skillId,
        String               sourceType,
        Map<String, Integer> difficultyDistribution,
        int                  totalCases,
        String               status,
        Instant              createdAt,
        Instant              updatedAt
) {
    public static DatasetResponse from(BenchmarkDataset d) {
        return new DatasetResponse(
                d.getId(),
                d.getDatasetCode(),
                d.getDatasetName(),
                d.getDescription(),
                d.getSkill() != null ? d.getSkill().getSkillId() : null,
                d.getSourceType().name().toLowerCase(Locale.ROOT),
                d.getDifficultyDistribution(),
                d.getTotalCases(),
                d.getStatus().name().toLowerCase(Locale.ROOT),
                d.getCreatedAt(),
                d.getUpdatedAt()
        );
    }
}
