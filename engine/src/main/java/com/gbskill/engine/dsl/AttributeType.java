package com.gbskill.engine.dsl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of value an attribute spec extracts.
 *
 * Only DIMENSION changes runtime behaviour: matched strings that look
 * numeric are coerced to numbers. The other kinds are descriptive.
 */
public enum AttributeType {
    DIMENSION,
    MATERIAL,
    PERFORMANCE,
    SPECIFICATION,
    CATEGORY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AttributeType fromWire(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown attribute type: '" + value + "'");
        }
    }
}
