package com.gbskill.engine.runtime;

import com.gbskill.engine.dsl.CategoryMapping;
import com.gbskill.engine.dsl.CompiledSkill;
import com.gbskill.engine.dsl.FallbackStrategy;
import com.gbskill.engine.dsl.SkillDsl;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.gbskill.engine.runtime.StandardAttributes.MATERIAL;
import static com.gbskill.engine.runtime.StandardAttributes.NOMINAL_DIAMETER;

/**
 * Assembles the final {@link MaterialParseResult}.
 *
 * The material name is built as {@code [材质] + noun + [DN{公称直径}]}, where
 * the noun is 管 for the pipe domain and 件 otherwise. Without either a
 * material or a diameter the first characters of the raw input are used.
 */
@Component
public class StructBuilder {

    static final double EMPTY_CONFIDENCE = 0.5;
    static final int MATCHED_NAME_CHARS = 20;
    static final int DEFAULT_NAME_CHARS = 50;

    public MaterialParseResult build(String inputText, Map<String, ParsedAttribute> attributes,
                                     CategoryMapping category, CompiledSkill skill) {
        SkillDsl dsl = skill.dsl();

        double confidence = attributes.isEmpty()
                ? EMPTY_CONFIDENCE
                : attributes.values().stream().mapToDouble(ParsedAttribute::confidence).average().orElse(EMPTY_CONFIDENCE);

        ParsedAttribute material = attributes.get(MATERIAL);
        ParsedAttribute diameter = attributes.get(NOMINAL_DIAMETER);

        String materialName;
        if (material == null && diameter == null) {
            materialName = prefix(inputText, MATCHED_NAME_CHARS);
        } else {
            String domain = dsl.domain() != null ? dsl.domain() : skill.domain();
            StringBuilder sb = new StringBuilder();
            if (material != null) sb.append(Scalars.text(material.value()));
            sb.append("pipe".equals(domain) ? "管" : "件");
            if (diameter != null) sb.append("DN").append(Scalars.text(diameter.value()));
            materialName = sb.toString();
        }

        String commonName = category.commonName();
        if ((commonName == null || commonName.isEmpty()) && material != null) {
            commonName = "工业用" + Scalars.text(material.value()) + "管材";
        }

        FallbackStrategy fallback = dsl.fallbackStrategy();
        boolean needsReview = fallback != null && fallback.requiresReview(confidence);

        return new MaterialParseResult(materialName, commonName == null ? "" : commonName, category,
                attributes, dsl.standardCode(), round3(confidence), needsReview);
    }

    /** Result for input no skill claimed. */
    public MaterialParseResult buildDefault(String inputText, double confidence) {
        return new MaterialParseResult(prefix(inputText, DEFAULT_NAME_CHARS), "",
                CategoryMapping.uncategorized(), Map.of(), null, round3(confidence), false);
    }

    static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }

    /** First {@code n} code points of {@code s}. */
    static String prefix(String s, int n) {
        if (s.codePointCount(0, s.length()) <= n) return s;
        return s.substring(0, s.offsetByCodePoints(0, n));
    }
}
