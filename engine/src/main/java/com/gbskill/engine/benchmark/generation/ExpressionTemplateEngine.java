package com.gbskill.engine.benchmark.generation;

import com.gbskill.engine.model.CaseDifficulty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders attribute combinations into purchase-style text and degrades the
 * text according to difficulty.
 *
 * <ul>
 *   <li>EASY: the domain's first template, verbatim.</li>
 *   <li>MEDIUM: the middle template; synonym substitution, lower-casing and
 *       unit removal, each gated independently.</li>
 *   <li>HARD: a random template; medium transforms, then token shuffling and
 *       an irrelevant prefix.</li>
 *   <li>ADVERSARIAL: hard transforms, then one typo or one swap of adjacent
 *       characters.</li>
 * </ul>
 *
 * All randomness comes from the injected {@link Random}, so a seeded source
 * reproduces the same texts.
 */
public class ExpressionTemplateEngine {

    static final Map<String, List<String>> TEMPLATES = Map.of(
            "pipe", List.of(
                    "{材质}管 DN{公称直径} PN{公称压力}",
                    "{材质}管材 DN{公称直径}mm PN{公称压力}MPa",
                    "DN{公称直径} PN{公称压力} {材质}管",
                    "{材质}管 DN{公称直径}",
                    "DN{公称直径}管 {材质}",
                    "{材质}管道 直径{公称直径} 压力{公称压力}",
                    "管材规格: DN{公称直径}, PN{公称压力}"),
            "fastener", List.of(
                    "{头型}螺栓 {规格} {材质} {表面处理}",
                    "{材质}{头型}螺栓{规格}",
                    "螺栓 {规格} {材质}",
                    "{规格}螺栓",
                    "{头型}螺丝 {规格}"),
            "default", List.of(
                    "{name} {规格}",
                    "{材质} {name}"));

    static final Map<String, List<String>> SYNONYMS = new LinkedHashMap<>();
    static {
        SYNONYMS.put("管", List.of("管材", "管道", "管子"));
        SYNONYMS.put("螺栓", List.of("螺丝", "螺柱", "bolt"));
        SYNONYMS.put("六角头", List.of("六角", "外六角", "Hex"));
        SYNONYMS.put("PVC-U", List.of("UPVC", "PVC", "硬PVC", "聚氯乙烯"));
        SYNONYMS.put("PPR", List.of("PP-R", "无规共聚聚丙烯"));
        SYNONYMS.put("不锈钢", List.of("304不锈钢", "316不锈钢", "不锈钢材质"));
    }

    static final Map<String, String> TYPOS = new LinkedHashMap<>();
    static {
        TYPOS.put("管材", "管才");
        TYPOS.put("螺栓", "螺拴");
        TYPOS.put("直径", "直经");
        TYPOS.put("压力", "压励");
    }

    static final List<String> FILLER_PREFIXES = List.of("一批", "急需", "现货", "优质", "国标");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{[^}]+}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern UNIT = Pattern.compile("(mm|MPa|cm|m)\\b");

    private final List<String> templates;
    private final Random random;

    public ExpressionTemplateEngine(String domain, Random random) {
        this.templates = TEMPLATES.getOrDefault(domain, TEMPLATES.get("default"));
        this.random = random;
    }

    /**
     * @param includeVariants when false every difficulty renders the first
     *                        template and only the text transforms vary
     */
    public String generate(Map<String, Object> attributes, CaseDifficulty difficulty, boolean includeVariants) {
        String template = includeVariants ? selectTemplate(difficulty) : templates.get(0);
        String text = render(template, attributes);
        return switch (difficulty) {
            case EASY -> text;
            case MEDIUM -> mediumTransforms(text);
            case HARD -> hardTransforms(text);
            case ADVERSARIAL -> adversarialTransforms(text);
        };
    }

    String selectTemplate(CaseDifficulty difficulty) {
        return switch (difficulty) {
            case EASY -> templates.get(0);
            case MEDIUM -> templates.get(Math.min(templates.size() / 2, templates.size() - 1));
            default -> templates.get(random.nextInt(templates.size()));
        };
    }

    /**
     * Substitutes {@code {name}} placeholders, drops unfilled ones and
     * collapses whitespace. Keys starting with {@code _} are ignored.
     */
    public static String render(String template, Map<String, Object> attributes) {
        String result = template;
        for (Map.Entry<String, Object> e : attributes.entrySet()) {
            if (e.getKey().startsWith("_")) continue;
            result = result.replace("{" + e.getKey() + "}", String.valueOf(e.getValue()));
        }
        result = PLACEHOLDER.matcher(result).replaceAll("");
        return WHITESPACE.matcher(result).replaceAll(" ").strip();
    }

    // ------------------------------------------------------------------
    // Difficulty transforms
    // ------------------------------------------------------------------

    String mediumTransforms(String text) {
        String result = text;
        if (random.nextDouble() < 0.5) {
            result = replaceSynonyms(result, 0.3);
        }
        if (random.nextDouble() < 0.5 && random.nextDouble() < 0.3) {
            result = result.toLowerCase(Locale.ROOT);
        }
        if (random.nextDouble() < 0.5 && random.nextDouble() < 0.5) {
            result = UNIT.matcher(result).replaceAll("");
        }
        return result.strip();
    }

    String hardTransforms(String text) {
        String result = mediumTransforms(text);
        if (random.nextDouble() < 0.3) {
            List<String> words = new ArrayList<>(List.of(WHITESPACE.split(result)));
            Collections.shuffle(words, random);
            result = String.join(" ", words);
        }
        if (random.nextDouble() < 0.3) {
            result = pick(FILLER_PREFIXES) + " " + result;
        }
        return result.strip();
    }

    String adversarialTransforms(String text) {
        String result = hardTransforms(text);
        if (random.nextDouble() < 0.5) {
            for (Map.Entry<String, String> typo : TYPOS.entrySet()) {
                if (result.contains(typo.getKey())) {
                    return result.replaceFirst(Pattern.quote(typo.getKey()), Matcher.quoteReplacement(typo.getValue())).strip();
                }
            }
        }
        return swapAdjacent(result, random).strip();
    }

    String replaceSynonyms(String text, double probability) {
        String result = text;
        for (Map.Entry<String, List<String>> e : SYNONYMS.entrySet()) {
            if (result.contains(e.getKey()) && random.nextDouble() < probability) {
                result = result.replaceFirst(Pattern.quote(e.getKey()), Matcher.quoteReplacement(pick(e.getValue())));
            }
        }
        return result;
    }

    /** Swaps two neighbouring characters away from either end; short text is returned as is. */
    static String swapAdjacent(String text, Random random) {
        if (text.length() < 4) return text;
        char[] chars = text.toCharArray();
        int i = 1 + random.nextInt(chars.length - 2);
        char tmp = chars[i];
        chars[i] = chars[i + 1];
        chars[i + 1] = tmp;
        return new String(chars);
    }

    private String pick(List<String> options) {
        return options.get(random.nextInt(options.size()));
    }
}
