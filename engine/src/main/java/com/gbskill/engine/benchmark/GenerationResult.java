package com.gbskill.engine.benchmark;

import java.util.Map;

/**
 * Summary of one generation request.
 *
 * @param byDifficulty      difficulty key → cases generated
 * @param bySource          case source key → cases generated
 * @param totalCombinations distinct attribute combinations available to draw from
 */
public record GenerationResult(
        int                  generatedCount,
        Map<String, Integer> byDifficulty,
        Map<String, Integer> bySource,
        int                  totalCombinations) {}
