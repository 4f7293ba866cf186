package com.gbskill.engine.runtime;

import com.gbskill.engine.TestSkills;
import com.gbskill.engine.dsl.SkillDsl;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RuleEngineTest {

    private final RuleEngine engine = new RuleEngine();

    @Test
    void apply_noDeclaredMaterialRule_usesBuiltInDescription() {
        RuleEngine.RuleApplication r = engine.apply(attrs("材质", "PVC-U"), TestSkills.pipeDsl());

        ParsedAttribute fitting = r.attributes().get("管件材质");
        assertThat(fitting.value()).isEqualTo("硬聚氯乙烯(PVC)");
        assertThat(fitting.source()).isEqualTo(AttributeSource.RULE);
        assertThat(fitting.confidence()).isEqualTo(1.0);
        assertThat(r.applied()).containsExactly("material_desc:PVC-U");
    }

    @Test
    void apply_unmappedMaterial_addsNothing() {
        RuleEngine.RuleApplication r = engine.apply(attrs("材质", "铸铁"), TestSkills.pipeDsl());

        assertThat(r.attributes()).containsOnlyKeys("材质");
        assertThat(r.applied()).isEmpty();
    }

    @Test
    void apply_declaredInlineMapping_replacesBuiltIn() {
        SkillDsl dsl = TestSkills.PARSER.parse("""
                {"rules": {"material_grade": {
                    "sourceAttribute": "材质", "targetAttribute": "管件材质",
                    "mapping": {"PVC-U": "PVC-U 给水级"}}}}
                """);

        RuleEngine.RuleApplication r = engine.apply(attrs("材质", "PVC-U"), dsl);

        assertThat(r.attributes().get("管件材质").value()).isEqualTo("PVC-U 给水级");
        assertThat(r.attributes().get("管件材质").description()).isEqualTo("材质为PVC-U时对应PVC-U 给水级");
        assertThat(r.applied()).containsExactly("material_grade:PVC-U");
    }

    @Test
    void apply_mappingTable_looksUpByNumericKey() {
        SkillDsl dsl = TestSkills.PARSER.parse("""
                {"tables": {"od": {"columns": ["dn", "od"], "data": [[100, 110]]}},
                 "rules": {"dn_to_od": {"sourceAttribute": "公称直径", "targetAttribute": "外径", "mappingTable": "od"}}}
                """);

        RuleEngine.RuleApplication r = engine.apply(attrs("公称直径", "100"), dsl);

        assertThat(r.attributes().get("外径").value()).isEqualTo(110);
    }

    @Test
    void apply_existingTarget_neverOverwritten() {
        Map<String, ParsedAttribute> input = attrs("材质", "PE");
        input.put("管件材质", ParsedAttribute.of("自定义", AttributeSource.PATTERN, "", "管件材质", null));

        RuleEngine.RuleApplication r = engine.apply(input, TestSkills.pipeDsl());

        assertThat(r.attributes().get("管件材质").value()).isEqualTo("自定义");
        assertThat(r.applied()).isEmpty();
    }

    @Test
    void apply_tableOnlyCompilerRule_isIgnored() {
        SkillDsl dsl = TestSkills.PARSER.parse("""
                {"tables": {"od": {"columns": ["dn", "od"], "data": [[100, 110]]}},
                 "rules": {"lookup": {"type": "table_lookup", "mappingTable": "od"}}}
                """);

        RuleEngine.RuleApplication r = engine.apply(attrs("公称直径", 100), dsl);

        assertThat(r.applied()).isEmpty();
    }

    private static Map<String, ParsedAttribute> attrs(String name, Object value) {
        Map<String, ParsedAttribute> m = new LinkedHashMap<>();
        m.put(name, ParsedAttribute.of(value, AttributeSource.PATTERN, "", name, null));
        return m;
    }
}
