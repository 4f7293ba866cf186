package com.gbskill.engine.runtime;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Provenance of an extracted attribute. Each source carries a fixed confidence.
 */
public enum AttributeSource {
    PATTERN(0.9),
    TABLE(1.0),
    RULE(1.0),
    DEFAULT(0.5);

    private final double confidence;

    AttributeSource(double confidence) {
        this.confidence = confidence;
    }

    public double confidence() {
        return confidence;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
