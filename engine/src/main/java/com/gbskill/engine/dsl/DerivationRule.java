package com.gbskill.engine.dsl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * A value-to-value derivation keyed by a source attribute.
 *
 * The mapping comes either inline ({@code mapping}) or from the first two
 * columns of a named table ({@code mappingTable}). Compiler-emitted rules
 * that name only a table and no source attribute describe table lookups
 * done by the table engine; the rule engine leaves them alone.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"type", "description", "sourceAttribute", "targetAttribute",
        "displayName", "mappingTable", "mapping"})
public record DerivationRule(
        String              type,
        String              description,
        String              sourceAttribute,
        String              targetAttribute,
        String              displayName,
        String              mappingTable,
        Map<String, Object> mapping) {

    /** True when the rule names both ends of a derivation the rule engine can run. */
    public boolean executable() {
        return sourceAttribute != null && !sourceAttribute.isBlank()
                && targetAttribute != null && !targetAttribute.isBlank()
                && (mapping != null || mappingTable != null);
    }
}
