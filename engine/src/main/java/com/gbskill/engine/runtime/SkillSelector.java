package com.gbskill.engine.runtime;

import com.gbskill.engine.dsl.CompiledSkill;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scores candidate skills against raw input text.
 *
 * <pre>
 *   score = min( (1.0 × keywords found + 1.5 × patterns found) / max(keywords + patterns, 1), 1.0 )
 * </pre>
 *
 * Candidates must arrive in descending priority. Only a strictly greater
 * score displaces the current leader, so ties go to the higher-priority
 * skill. A zero score never matches.
 */
@Component
public class SkillSelector {

    static final double KEYWORD_WEIGHT = 1.0;
    static final double PATTERN_WEIGHT = 1.5;

    public SkillMatch select(String inputText, List<CompiledSkill> candidates) {
        CompiledSkill best = null;
        double bestScore = 0.0;
        Map<String, Double> all = new LinkedHashMap<>();

        for (CompiledSkill skill : candidates) {
            double score = score(inputText, skill);
            all.put(skill.skillId(), score);
            if (score > bestScore) {
                bestScore = score;
                best = skill;
            }
        }
        return new SkillMatch(best, bestScore, all);
    }

    public double score(String inputText, CompiledSkill skill) {
        String lower = inputText.toLowerCase(Locale.ROOT);
        List<String> keywords = skill.keywords();
        List<Pattern> patterns = skill.recognitionPatterns();

        double raw = 0.0;
        for (String kw : keywords) {
            if (lower.contains(kw)) raw += KEYWORD_WEIGHT;
        }
        for (Pattern p : patterns) {
            if (p.matcher(inputText).find()) raw += PATTERN_WEIGHT;
        }

        // Dropped invalid patterns still count toward the denominator.
        int declared = skill.dsl().recognitionOrEmpty().keywordsOrEmpty().size()
                + skill.dsl().recognitionOrEmpty().patternsOrEmpty().size();
        return Math.min(raw / Math.max(declared, 1), 1.0);
    }
}
