package com.gbskill.engine.runtime;

import com.gbskill.engine.TestSkills;
import com.gbskill.engine.dsl.CompiledSkill;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AttributeExtractorTest {

    private final AttributeExtractor extractor = new AttributeExtractor();

    @Test
    void extract_dimensionValue_coercedToNumberWithPatternConfidence() {
        Map<String, ParsedAttribute> attrs = extractor.extract("PVC-U管 DN100 PN1.6", TestSkills.pipeSkill());

        ParsedAttribute dn = attrs.get("公称直径");
        assertThat(dn.value()).isEqualTo(100);
        assertThat(dn.confidence()).isEqualTo(0.9);
        assertThat(dn.source()).isEqualTo(AttributeSource.PATTERN);
        assertThat(dn.unit()).isEqualTo("mm");
        assertThat(dn.displayName()).isEqualTo("公称直径DN");
        assertThat(attrs.get("公称压力").value()).isEqualTo(1.6);
    }

    @Test
    void extract_firstDeclaredPatternWins() {
        // the second pattern matches earlier in the text, the first still decides
        Map<String, ParsedAttribute> attrs = extractor.extract("dn = 50 DN100", TestSkills.pipeSkill());

        assertThat(attrs.get("公称直径").value()).isEqualTo(100);
    }

    @Test
    void extract_noMatch_usesDefaultValue() {
        Map<String, ParsedAttribute> attrs = extractor.extract("给水管 DN50", TestSkills.pipeSkill());

        ParsedAttribute material = attrs.get("材质");
        assertThat(material.value()).isEqualTo("PVC-U");
        assertThat(material.source()).isEqualTo(AttributeSource.DEFAULT);
        assertThat(material.confidence()).isEqualTo(0.5);
    }

    @Test
    void extract_noMatchNoDefault_attributeOmitted() {
        Map<String, ParsedAttribute> attrs = extractor.extract("PVC-U管 DN50", TestSkills.pipeSkill());

        assertThat(attrs).doesNotContainKey("公称压力");
        assertThat(attrs.keySet()).containsExactly("材质", "公称直径");
    }

    @Test
    void extract_patternWithoutGroup_usesWholeMatch() {
        CompiledSkill skill = TestSkills.compile("grade", """
                {"attributeExtraction": {"等级": {"type": "specification", "patterns": ["[A-C]级"]}}}
                """);

        assertThat(extractor.extract("钢筋 B级", skill).get("等级").value()).isEqualTo("B级");
    }

    @Test
    void extract_nonDimension_keepsString() {
        CompiledSkill skill = TestSkills.compile("len", """
                {"attributeExtraction": {"长度": {"type": "specification", "patterns": ["L(\\\\d+)"]}}}
                """);

        assertThat(extractor.extract("L600", skill).get("长度").value()).isEqualTo("600");
    }

    @Test
    void extract_missingDisplayName_fallsBackToAttributeName() {
        CompiledSkill skill = TestSkills.compile("len", """
                {"attributeExtraction": {"长度": {"type": "dimension", "patterns": ["L(\\\\d+)"]}}}
                """);

        assertThat(extractor.extract("L600", skill).get("长度").displayName()).isEqualTo("长度");
    }
}
