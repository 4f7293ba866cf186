package com.gbskill.engine.dsl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * In-memory form of a skill used by the runtime: the validated DSL plus
 * every regular expression compiled once, case-insensitively.
 *
 * Patterns that fail to compile are dropped with a warning; the rest of the
 * skill stays usable. Instances are immutable and safe to share across threads.
 */
public final class CompiledSkill {

    private static final Logger log = LoggerFactory.getLogger(CompiledSkill.class);

    private final String skillId;
    private final String skillName;
    private final String domain;
    private final int priority;
    private final String dslVersion;
    private final SkillDsl dsl;
    private final List<String> keywords;
    private final List<Pattern> recognitionPatterns;
    private final Map<String, List<Pattern>> attributePatterns;

    private CompiledSkill(String skillId, String skillName, String domain, int priority,
                          String dslVersion, SkillDsl dsl) {
        this.skillId = skillId;
        this.skillName = skillName;
        this.domain = domain;
        this.priority = priority;
        this.dslVersion = dslVersion;
        this.dsl = dsl;

        List<String> kw = new ArrayList<>();
        for (String k : dsl.recognitionOrEmpty().keywordsOrEmpty()) {
            if (k != null && !k.isEmpty()) {
                kw.add(k.toLowerCase(Locale.ROOT));
            }
        }
        this.keywords = Collections.unmodifiableList(kw);
        this.recognitionPatterns = compileAll(dsl.recognitionOrEmpty().patternsOrEmpty(), "intentRecognition");

        Map<String, List<Pattern>> byAttr = new LinkedHashMap<>();
        dsl.attributesOrEmpty().forEach((name, spec) ->
                byAttr.put(name, compileAll(spec.patternsOrEmpty(), "attribute '" + name + "'")));
        this.attributePatterns = Collections.unmodifiableMap(byAttr);
    }

    public static CompiledSkill compile(String skillId, String skillName, String domain,
                                        int priority, String dslVersion, SkillDsl dsl) {
        return new CompiledSkill(skillId, skillName, domain, priority, dslVersion, dsl);
    }

    private List<Pattern> compileAll(List<String> sources, String owner) {
        List<Pattern> out = new ArrayList<>(sources.size());
        for (String src : sources) {
            if (src == null) continue;
            try {
                out.add(Pattern.compile(src, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            } catch (PatternSyntaxException e) {
                log.warn("Skill '{}': dropping invalid pattern '{}' in {}: {}",
                        skillId, src, owner, e.getDescription());
            }
        }
        return Collections.unmodifiableList(out);
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public String skillId()                   { return skillId; }
    public String skillName()                 { return skillName; }
    public String domain()                    { return domain; }
    public int priority()                     { return priority; }
    public String dslVersion()                { return dslVersion; }
    public SkillDsl dsl()                     { return dsl; }
    public List<String> keywords()            { return keywords; }
    public List<Pattern> recognitionPatterns() { return recognitionPatterns; }

    /** Compiled patterns of one attribute, in declared order; empty if unknown. */
    public List<Pattern> attributePatterns(String attributeName) {
        return attributePatterns.getOrDefault(attributeName, List.of());
    }

    public String standardCode() {
        return dsl.standardCode();
    }

    @Override
    public String toString() {
        return "CompiledSkill[" + skillId + " v" + dslVersion + ", priority=" + priority + "]";
    }
}
