package com.gbskill.engine.benchmark.generation;

import com.gbskill.engine.model.CaseDifficulty;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Adds purchase-order clutter to generated text, independently of the
 * difficulty transforms.
 *
 * With probability 0 / 0.2 / 0.4 / 0.6 (easy to adversarial) exactly one
 * kind of noise is applied: a prefix, a suffix, a swap of adjacent
 * characters, or a doubled space.
 *
 * A template's noise rules may replace the phrase lists through the keys
 * {@code prefixes} and {@code suffixes}.
 */
public class NoiseInjector {

    static final List<String> DEFAULT_PREFIXES = List.of("采购", "询价", "需要", "订购", "紧急采购");
    static final List<String> DEFAULT_SUFFIXES = List.of("若干", "100根", "一批", "1000个", "等");

    private final Random random;
    private final List<String> prefixes;
    private final List<String> suffixes;

    public NoiseInjector(Random random) {
        this(random, null);
    }

    public NoiseInjector(Random random, Map<String, Object> rules) {
        this.random = random;
        this.prefixes = phrases(rules, "prefixes", DEFAULT_PREFIXES);
        this.suffixes = phrases(rules, "suffixes", DEFAULT_SUFFIXES);
    }

    public static double noiseLevel(CaseDifficulty difficulty) {
        return switch (difficulty) {
            case EASY -> 0.0;
            case MEDIUM -> 0.2;
            case HARD -> 0.4;
            case ADVERSARIAL -> 0.6;
        };
    }

    public String inject(String text, CaseDifficulty difficulty) {
        if (random.nextDouble() >= noiseLevel(difficulty)) {
            return text;
        }
        return switch (random.nextInt(4)) {
            case 0 -> pick(prefixes) + " " + text;
            case 1 -> text + " " + pick(suffixes);
            case 2 -> ExpressionTemplateEngine.swapAdjacent(text, random);
            default -> widenSpace(text);
        };
    }

    private String widenSpace(String text) {
        String[] words = text.split(" ");
        if (words.length <= 1) return text;
        int i = random.nextInt(words.length);
        words[i] = words[i] + "  ";
        return String.join(" ", words);
    }

    private String pick(List<String> options) {
        return options.get(random.nextInt(options.size()));
    }

    private static List<String> phrases(Map<String, Object> rules, String key, List<String> fallback) {
        if (rules == null || !(rules.get(key) instanceof List<?> list) || list.isEmpty()) {
            return fallback;
        }
        return list.stream().map(String::valueOf).toList();
    }
}
