package com.gbskill.engine.dsl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads, validates and writes the JSON form of a {@link SkillDsl}.
 *
 * Validation is structural only: attribute types must be known, table rows
 * must fit their columns and hold scalars, the fallback threshold must lie in
 * [0, 1] and executable rules must name both their source and target.
 * Regular expressions are checked later, when the skill is compiled, since a
 * bad pattern only drops that pattern.
 */
@Component
public class DslParser {

    private final ObjectMapper objectMapper;

    public DslParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse and validate a stored DSL payload.
     *
     * @throws DslValidationException if the JSON is malformed or structurally invalid
     */
    public SkillDsl parse(String json) {
        if (json == null || json.isBlank()) {
            throw new DslValidationException("DSL content is empty");
        }
        SkillDsl dsl;
        try {
            dsl = objectMapper.readValue(json, SkillDsl.class);
        } catch (JsonProcessingException e) {
            throw new DslValidationException("Malformed DSL JSON: " + e.getOriginalMessage(), e);
        }
        validate(dsl);
        return dsl;
    }

    public String write(SkillDsl dsl) {
        try {
            return objectMapper.writeValueAsString(dsl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise skill DSL", e);
        }
    }

    /** Re-encodes arbitrary JSON (a request body, say) after validating it as a DSL. */
    public String normalize(Object rawDsl) {
        String json;
        try {
            json = rawDsl instanceof String s ? s : objectMapper.writeValueAsString(rawDsl);
        } catch (JsonProcessingException e) {
            throw new DslValidationException("DSL payload is not serialisable: " + e.getOriginalMessage(), e);
        }
        return write(parse(json));
    }

    // ------------------------------------------------------------------
    // Structural validation
    // ------------------------------------------------------------------

    public void validate(SkillDsl dsl) {
        List<String> problems = new ArrayList<>();

        for (Map.Entry<String, AttributeSpec> e : dsl.attributesOrEmpty().entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) {
                problems.add("attribute with blank name");
            } else if (e.getValue() == null) {
                problems.add("attribute '" + e.getKey() + "' has no definition");
            }
        }

        for (Map.Entry<String, LookupTable> e : dsl.tablesOrEmpty().entrySet()) {
            validateTable(e.getKey(), e.getValue(), problems);
        }

        for (Map.Entry<String, DerivationRule> e : dsl.rulesOrEmpty().entrySet()) {
            validateRule(e.getKey(), e.getValue(), dsl, problems);
        }

        FallbackStrategy fallback = dsl.fallbackStrategy();
        if (fallback != null && fallback.lowConfidenceThreshold() != null) {
            double t = fallback.lowConfidenceThreshold();
            if (t < 0.0 || t > 1.0) {
                problems.add("fallbackStrategy.lowConfidenceThreshold must be within [0, 1], was " + t);
            }
        }

        if (!problems.isEmpty()) {
            throw new DslValidationException(problems);
        }
    }

    private void validateTable(String name, LookupTable table, List<String> problems) {
        if (table == null) {
            problems.add("table '" + name + "' has no definition");
            return;
        }
        int width = table.columnsOrEmpty().size();
        List<List<Object>> rows = table.rowsOrEmpty();
        for (int r = 0; r < rows.size(); r++) {
            List<Object> row = rows.get(r);
            if (row == null) {
                problems.add("table '" + name + "' row " + r + " is null");
                continue;
            }
            if (width > 0 && row.size() > width) {
                problems.add("table '" + name + "' row " + r + " has " + row.size()
                        + " cells but only " + width + " columns");
            }
            for (Object cell : row) {
                if (cell != null && !(cell instanceof Number) && !(cell instanceof String)
                        && !(cell instanceof Boolean)) {
                    problems.add("table '" + name + "' row " + r + " holds a non-scalar cell");
                    break;
                }
            }
        }
    }

    private void validateRule(String name, DerivationRule rule, SkillDsl dsl, List<String> problems) {
        if (rule == null) {
            problems.add("rule '" + name + "' has no definition");
            return;
        }
        boolean hasSource = rule.sourceAttribute() != null && !rule.sourceAttribute().isBlank();
        boolean hasTarget = rule.targetAttribute() != null && !rule.targetAttribute().isBlank();
        if (rule.mapping() != null && (!hasSource || !hasTarget)) {
            problems.add("rule '" + name + "' has a mapping but no sourceAttribute/targetAttribute");
        }
        if (hasSource && rule.mappingTable() != null && dsl.table(rule.mappingTable()) == null) {
            problems.add("rule '" + name + "' refers to unknown table '" + rule.mappingTable() + "'");
        }
    }
}
