package com.gbskill.engine.dsl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What to do with results whose aggregate confidence is low.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FallbackStrategy(Double lowConfidenceThreshold, Boolean humanReviewRequired) {

    public boolean requiresReview(double confidence) {
        return Boolean.TRUE.equals(humanReviewRequired)
                && lowConfidenceThreshold != null
                && confidence < lowConfidenceThreshold;
    }
}
