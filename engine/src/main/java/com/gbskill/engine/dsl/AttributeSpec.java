package com.gbskill.engine.dsl;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Extraction rules for one attribute.
 *
 * Patterns are tried in declared order and the first match wins. When a
 * pattern has a capture group, group 1 is the value; otherwise the whole
 * match is.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"type", "unit", "patterns", "required", "defaultValue",
        "allowedValues", "displayName", "description"})
public record AttributeSpec(
        AttributeType type,
        String        unit,
        List<String>  patterns,
        Boolean       required,
        Object        defaultValue,
        @JsonAlias("enum")
        List<Object>  allowedValues,
        String        displayName,
        String        description) {

    public List<String> patternsOrEmpty() {
        return patterns == null ? List.of() : patterns;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public boolean mandatory() {
        return Boolean.TRUE.equals(required);
    }

    public String unitOrBlank() {
        return unit == null ? "" : unit;
    }
}
