package com.gbskill.engine.benchmark;

import java.util.Map;

/**
 * Parameters of generation from a skill.
 *
 * @param difficultyDistribution difficulty key → percentage; null for 40/30/20/10
 * @param includeNoise           apply purchase-order noise on top of the difficulty transforms
 * @param includeVariants        let harder cases use alternative templates
 */
public record GenerationOptions(
        String               skillId,
        int                  count,
        Map<String, Integer> difficultyDistribution,
        boolean              includeNoise,
        boolean              includeVariants) {

    public GenerationOptions {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1, was " + count);
        }
    }
}
