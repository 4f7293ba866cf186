package com.gbskill.engine.runtime;

/**
 * One attribute of a parse result with its provenance.
 *
 * @param description for derived attributes, the table or rule the value came from
 */
public record ParsedAttribute(
        Object          value,
        double          confidence,
        AttributeSource source,
        String          unit,
        String          displayName,
        String          description) {

    public static ParsedAttribute of(Object value, AttributeSource source, String unit,
                                     String displayName, String description) {
        return new ParsedAttribute(value, source.confidence(), source,
                unit == null ? "" : unit,
                displayName == null ? "" : displayName,
                description == null ? "" : description);
    }
}
