package com.gbskill.engine.dsl;

import com.fasterxml.jackson.databind.JsonNode;
import com.gbskill.engine.TestSkills;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DslParserTest {

    private final DslParser parser = TestSkills.PARSER;

    // ------------------------------------------------------------------
    // parse
    // ------------------------------------------------------------------

    @Test
    void parse_pipeSkill_readsAllSections() {
        SkillDsl dsl = parser.parse(TestSkills.pipeDslJson());

        assertThat(dsl.skillId()).isEqualTo("skill_pvc_u_pipe");
        assertThat(dsl.attributesOrEmpty()).containsOnlyKeys("材质", "公称直径", "公称压力");
        assertThat(dsl.attributesOrEmpty().get("公称直径").type()).isEqualTo(AttributeType.DIMENSION);
        assertThat(dsl.table("dimension_table").columns()).containsExactly("公称外径", "S10壁厚", "S6.3壁厚");
        assertThat(dsl.categoryMapping().commonName()).isEqualTo("PVC-U给水管");
        assertThat(dsl.fallbackStrategy().lowConfidenceThreshold()).isEqualTo(0.6);
    }

    @Test
    void parse_keepsAttributeOrderOfSource() {
        SkillDsl dsl = parser.parse(TestSkills.pipeDslJson());

        assertThat(dsl.attributesOrEmpty().keySet()).containsExactly("材质", "公称直径", "公称压力");
    }

    @Test
    void parse_enumAliasAndRowsAlias_accepted() {
        SkillDsl dsl = parser.parse("""
                {"attributeExtraction": {"颜色": {"type": "specification", "enum": ["白", "灰"]}},
                 "tables": {"t": {"columns": ["a", "b"], "rows": [[1, 2]]}}}
                """);

        assertThat(dsl.attributesOrEmpty().get("颜色").allowedValues()).containsExactly("白", "灰");
        assertThat(dsl.table("t").rowsOrEmpty()).hasSize(1);
    }

    @Test
    void parse_emptyContent_throws() {
        assertThatThrownBy(() -> parser.parse("  "))
                .isInstanceOf(DslValidationException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void parse_malformedJson_throws() {
        assertThatThrownBy(() -> parser.parse("{\"skillId\": "))
                .isInstanceOf(DslValidationException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void parse_unknownAttributeType_throws() {
        assertThatThrownBy(() -> parser.parse("""
                {"attributeExtraction": {"x": {"type": "colour"}}}
                """))
                .isInstanceOf(DslValidationException.class);
    }

    // ------------------------------------------------------------------
    // validate
    // ------------------------------------------------------------------

    @Test
    void validate_rowWiderThanColumns_reportsProblem() {
        assertThatThrownBy(() -> parser.parse("""
                {"tables": {"t": {"columns": ["a"], "data": [[1, 2]]}}}
                """))
                .isInstanceOfSatisfying(DslValidationException.class, e ->
                        assertThat(e.getProblems()).anyMatch(p -> p.contains("row 0 has 2 cells")));
    }

    @Test
    void validate_nonScalarCell_reportsProblem() {
        assertThatThrownBy(() -> parser.parse("""
                {"tables": {"t": {"columns": ["a", "b"], "data": [[1, {"x": 1}]]}}}
                """))
                .isInstanceOf(DslValidationException.class)
                .hasMessageContaining("non-scalar");
    }

    @Test
    void validate_ruleWithUnknownTable_reportsProblem() {
        assertThatThrownBy(() -> parser.parse("""
                {"rules": {"r": {"sourceAttribute": "a", "targetAttribute": "b", "mappingTable": "nope"}}}
                """))
                .isInstanceOf(DslValidationException.class)
                .hasMessageContaining("unknown table 'nope'");
    }

    @Test
    void validate_thresholdOutOfRange_reportsProblem() {
        assertThatThrownBy(() -> parser.parse("""
                {"fallbackStrategy": {"lowConfidenceThreshold": 1.5, "humanReviewRequired": true}}
                """))
                .isInstanceOf(DslValidationException.class)
                .hasMessageContaining("lowConfidenceThreshold");
    }

    @Test
    void validate_collectsEveryProblem() {
        assertThatThrownBy(() -> parser.parse("""
                {"tables": {"t": {"columns": ["a"], "data": [[1, 2]]}},
                 "fallbackStrategy": {"lowConfidenceThreshold": -1}}
                """))
                .isInstanceOfSatisfying(DslValidationException.class, e ->
                        assertThat(e.getProblems()).hasSize(2));
    }

    // ------------------------------------------------------------------
    // normalize / write
    // ------------------------------------------------------------------

    @Test
    void normalize_storeLoadCycle_keepsTableShapeAndPatterns() throws Exception {
        String stored = parser.normalize(TestSkills.pipeDslJson());
        SkillDsl reloaded = parser.parse(stored);
        SkillDsl original = TestSkills.pipeDsl();

        assertThat(reloaded.tablesOrEmpty()).isEqualTo(original.tablesOrEmpty());
        assertThat(reloaded.attributesOrEmpty().get("公称直径").patterns())
                .containsExactly("DN(\\d+)", "dn\\s*=\\s*(\\d+)");
        assertThat(reloaded.categoryMapping()).isEqualTo(original.categoryMapping());

        JsonNode tree = TestSkills.MAPPER.readTree(stored);
        assertThat(tree.path("tables").path("dimension_table").path("data").get(0).get(1).isNull()).isTrue();
    }

    @Test
    void normalize_acceptsDecodedTree() {
        Map<String, Object> raw = Map.of(
                "skillId", "s1",
                "intentRecognition", Map.of("keywords", List.of("阀门")));

        String json = parser.normalize(raw);

        assertThat(parser.parse(json).recognitionOrEmpty().keywords()).containsExactly("阀门");
    }
}
