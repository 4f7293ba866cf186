package com.gbskill.engine.runtime;

import com.gbskill.engine.dsl.AttributeSpec;
import com.gbskill.engine.dsl.AttributeType;
import com.gbskill.engine.dsl.CompiledSkill;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies a skill's per-attribute patterns to the input text.
 *
 * For each attribute, in DSL order, the first pattern that matches decides
 * the value. With no match the default value is used; with no default the
 * attribute is left out of the result.
 */
@Component
public class AttributeExtractor {

    public Map<String, ParsedAttribute> extract(String inputText, CompiledSkill skill) {
        Map<String, ParsedAttribute> out = new LinkedHashMap<>();

        for (Map.Entry<String, AttributeSpec> e : skill.dsl().attributesOrEmpty().entrySet()) {
            String name = e.getKey();
            AttributeSpec spec = e.getValue();

            Object value = null;
            AttributeSource source = null;
            for (Pattern p : skill.attributePatterns(name)) {
                Matcher m = p.matcher(inputText);
                if (m.find()) {
                    // An optional group that did not take part yields null and falls through to the default.
                    value = m.groupCount() > 0 ? m.group(1) : m.group();
                    source = AttributeSource.PATTERN;
                    break;
                }
            }
            if (value == null && spec.hasDefault()) {
                value = spec.defaultValue();
                source = AttributeSource.DEFAULT;
            }
            if (value == null) {
                continue;
            }
            if (spec.type() == AttributeType.DIMENSION) {
                value = Scalars.coerceNumber(value);
            }
            out.put(name, ParsedAttribute.of(value, source, spec.unitOrBlank(),
                    spec.displayName() == null ? name : spec.displayName(),
                    spec.description()));
        }
        return out;
    }
}
