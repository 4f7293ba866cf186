package com.gbskill.engine.runtime;

import com.gbskill.engine.dsl.CategoryMapping;

import java.util.Map;

/**
 * Structured output of one parse.
 *
 * @param confidenceScore mean attribute confidence, rounded to three decimals
 * @param needsReview     set when the skill asks for human review below its threshold
 */
public record MaterialParseResult(
        String                       materialName,
        String                       commonName,
        CategoryMapping              category,
        Map<String, ParsedAttribute> attributes,
        String                       standardCode,
        double                       confidenceScore,
        boolean                      needsReview) {}
