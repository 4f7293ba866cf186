package com.gbskill.engine.dsl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Declarative payload of a Skill, as emitted by the DSL compiler.
 *
 * <p>Maps keep the insertion order of the source JSON, so attributes are
 * extracted in the order the standard lists them and a store/load cycle
 * writes them back in the same order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"skillId", "skillName", "version", "domain", "standardCode", "priority",
        "intentRecognition", "attributeExtraction", "rules", "tables",
        "categoryMapping", "outputStructure", "fallbackStrategy"})
public record SkillDsl(
        String                      skillId,
        String                      skillName,
        String                      version,
        String                      domain,
        String                      standardCode,
        Integer                     priority,
        IntentRecognition           intentRecognition,
        Map<String, AttributeSpec>  attributeExtraction,
        Map<String, DerivationRule> rules,
        Map<String, LookupTable>    tables,
        CategoryMapping             categoryMapping,
        Map<String, Object>         outputStructure,
        FallbackStrategy            fallbackStrategy) {

    public IntentRecognition recognitionOrEmpty() {
        return intentRecognition == null ? new IntentRecognition(null, null) : intentRecognition;
    }

    public Map<String, AttributeSpec> attributesOrEmpty() {
        return attributeExtraction == null ? Map.of() : attributeExtraction;
    }

    public Map<String, DerivationRule> rulesOrEmpty() {
        return rules == null ? Map.of() : rules;
    }

    public Map<String, LookupTable> tablesOrEmpty() {
        return tables == null ? Map.of() : tables;
    }

    public LookupTable table(String name) {
        return tablesOrEmpty().get(name);
    }
}
