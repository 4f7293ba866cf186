package com.gbskill.engine.runtime;

import com.gbskill.engine.dsl.DerivationRule;
import com.gbskill.engine.dsl.LookupTable;
import com.gbskill.engine.dsl.SkillDsl;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.gbskill.engine.runtime.StandardAttributes.FITTING_MATERIAL;
import static com.gbskill.engine.runtime.StandardAttributes.MATERIAL;

/**
 * Applies value-to-value rules from the DSL.
 *
 * A rule fires only when its source attribute is present, and only adds a
 * new attribute: a target that already exists is left untouched. Skills that
 * declare no rule on {@code 材质} get the built-in material description rule.
 */
@Component
public class RuleEngine {

    static final DerivationRule MATERIAL_DESCRIPTION = new DerivationRule(
            "mapping", "材质代号对应的管件材质描述", MATERIAL, FITTING_MATERIAL, FITTING_MATERIAL, null,
            materialDescriptions());

    /** Attributes after rule application and the rules that fired, as {@code name:sourceValue}. */
    public record RuleApplication(Map<String, ParsedAttribute> attributes, List<String> applied) {}

    public RuleApplication apply(Map<String, ParsedAttribute> input, SkillDsl dsl) {
        Map<String, ParsedAttribute> attrs = new LinkedHashMap<>(input);
        List<String> applied = new ArrayList<>();

        boolean materialRuleDeclared = false;
        for (Map.Entry<String, DerivationRule> e : dsl.rulesOrEmpty().entrySet()) {
            DerivationRule rule = e.getValue();
            if (!rule.executable()) continue;
            if (MATERIAL.equals(rule.sourceAttribute())) materialRuleDeclared = true;
            fire(e.getKey(), rule, dsl, attrs, applied);
        }
        if (!materialRuleDeclared) {
            fire("material_desc", MATERIAL_DESCRIPTION, dsl, attrs, applied);
        }
        return new RuleApplication(attrs, applied);
    }

    private void fire(String name, DerivationRule rule, SkillDsl dsl,
                      Map<String, ParsedAttribute> attrs, List<String> applied) {
        ParsedAttribute source = attrs.get(rule.sourceAttribute());
        if (source == null || source.value() == null || attrs.containsKey(rule.targetAttribute())) {
            return;
        }
        Object derived = rule.mapping() != null
                ? rule.mapping().get(Scalars.text(source.value()))
                : lookup(dsl.table(rule.mappingTable()), source.value());
        if (derived == null) {
            return;
        }
        String description = rule.description() != null ? rule.description()
                : rule.sourceAttribute() + "为" + source.value() + "时对应" + derived;
        attrs.put(rule.targetAttribute(), ParsedAttribute.of(derived, AttributeSource.RULE, "",
                rule.displayName() != null ? rule.displayName() : rule.targetAttribute(), description));
        applied.add(name + ":" + source.value());
    }

    /** First row whose column 0 equals the key; the value is column 1. */
    private static Object lookup(LookupTable table, Object key) {
        if (table == null) return null;
        for (List<Object> row : table.rowsOrEmpty()) {
            if (row != null && row.size() >= 2 && Scalars.keyMatches(row.get(0), key)) {
                return row.get(1);
            }
        }
        return null;
    }

    private static Map<String, Object> materialDescriptions() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("UPVC", "硬聚氯乙烯(PVC)");
        m.put("PVC-U", "硬聚氯乙烯(PVC)");
        m.put("PVC", "聚氯乙烯(PVC)");
        m.put("PE", "聚乙烯(PE)");
        m.put("PPR", "无规共聚聚丙烯(PP-R)");
        return m;
    }
}
