package com.gbskill.engine.benchmark;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gbskill.engine.benchmark.evaluation.EvaluationConfig;
import com.gbskill.engine.benchmark.evaluation.ExpectedAttribute;
import com.gbskill.engine.benchmark.generation.DifficultyDistribution;
import com.gbskill.engine.benchmark.generation.ExpressionTemplateEngine;
import com.gbskill.engine.benchmark.generation.NoiseInjector;
import com.gbskill.engine.benchmark.generation.ValueDomainExtractor;
import com.gbskill.engine.dsl.AttributeSpec;
import com.gbskill.engine.dsl.CompiledSkill;
import com.gbskill.engine.dsl.SkillDsl;
import com.gbskill.engine.model.BenchmarkCase;
import com.gbskill.engine.model.BenchmarkDataset;
import com.gbskill.engine.model.CaseDifficulty;
import com.gbskill.engine.model.CaseSourceType;
import com.gbskill.engine.model.DatasetSourceType;
import com.gbskill.engine.model.DatasetStatus;
import com.gbskill.engine.model.GenerationTemplate;
import com.gbskill.engine.model.Skill;
import com.gbskill.engine.repository.BenchmarkCaseRepository;
import com.gbskill.engine.repository.BenchmarkDatasetRepository;
import com.gbskill.engine.repository.GenerationTemplateRepository;
import com.gbskill.engine.repository.SkillRepository;
import com.gbskill.engine.runtime.SkillLoader;
import com.gbskill.engine.service.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

import static com.gbskill.engine.runtime.StandardAttributes.*;

/**
 * Synthesises labelled cases from a skill's own DSL, or from a stored
 * template and caller-supplied value lists.
 *
 * Setting {@code skillengine.benchmark.random-seed} makes every text
 * transform, sample and noise decision reproducible.
 */
@Service
public class BenchmarkDataGenerator {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkDataGenerator.class);

    static final Map<String, String> DEFAULT_UNITS = Map.of(
            NOMINAL_DIAMETER, "mm",
            OUTER_DIAMETER, "mm",
            NOMINAL_PRESSURE, "MPa",
            WALL_THICKNESS, "mm",
            "长度", "mm");

    static final Set<String> NUMERIC_ATTRIBUTES =
            Set.of(NOMINAL_DIAMETER, OUTER_DIAMETER, WALL_THICKNESS, "长度", NOMINAL_PRESSURE);

    static final double TEMPLATE_VARIANT_PROBABILITY = 0.3;

    private final SkillRepository skillRepository;
    private final SkillLoader skillLoader;
    private final BenchmarkDatasetRepository datasetRepository;
    private final BenchmarkCaseRepository caseRepository;
    private final GenerationTemplateRepository templateRepository;
    private final ObjectMapper objectMapper;
    private final Random random;

    public BenchmarkDataGenerator(SkillRepository skillRepository,
                                  SkillLoader skillLoader,
                                  BenchmarkDatasetRepository datasetRepository,
                                  BenchmarkCaseRepository caseRepository,
                                  GenerationTemplateRepository templateRepository,
                                  ObjectMapper objectMapper,
                                  @Value("${skillengine.benchmark.random-seed:#{null}}") Long randomSeed) {
        this.skillRepository = skillRepository;
        this.skillLoader = skillLoader;
        this.datasetRepository = datasetRepository;
        this.caseRepository = caseRepository;
        this.templateRepository = templateRepository;
        this.objectMapper = objectMapper;
        this.random = randomSeed != null ? new Random(randomSeed) : new Random();
    }

    // ------------------------------------------------------------------
    // From a skill
    // ------------------------------------------------------------------

    /**
     * Generate {@code options.count()} cases for a dataset from a skill's
     * tables (or, lacking a dimension table, its value domains).
     *
     * Combinations are reused round-robin when the count exceeds them.
     */
    @Transactional
    public GenerationResult generateFromSkill(UUID datasetId, GenerationOptions options) {
        BenchmarkDataset dataset = writableDataset(datasetId);
        Skill skill = skillRepository.findBySkillId(options.skillId())
                .orElseThrow(() -> new ResourceNotFoundException("Skill", options.skillId()));
        CompiledSkill compiled = skillLoader.compile(skill);
        SkillDsl dsl = compiled.dsl();
        String domain = dsl.domain() != null ? dsl.domain() : skill.getDomain();

        int limit = options.count() * 2;
        ValueDomainExtractor extractor = new ValueDomainExtractor(dsl);
        List<Map<String, Object>> combos = extractor.tableCombinations(limit);
        if (combos.isEmpty()) {
            combos = ValueDomainExtractor.crossProduct(extractor.valueDomains(), limit, random);
        }

        Map<String, Integer> byDifficulty = emptyCounts(CaseDifficulty.values());
        Map<String, Integer> bySource = emptyCounts(CaseSourceType.values());
        if (combos.isEmpty()) {
            log.warn("Skill '{}' has no tables or value domains to generate from", skill.getSkillId());
            return new GenerationResult(0, byDifficulty, bySource, 0);
        }

        Map<CaseDifficulty, Integer> plan =
                DifficultyDistribution.allocate(options.difficultyDistribution(), options.count());
        ExpressionTemplateEngine templates = new ExpressionTemplateEngine(domain, random);
        NoiseInjector noise = new NoiseInjector(random);
        AttributeSpec materialSpec = dsl.attributesOrEmpty().get(MATERIAL);
        Object defaultMaterial = materialSpec != null ? materialSpec.defaultValue() : null;
        Map<String, Object> expectedCategory = dsl.categoryMapping() == null ? null
                : objectMapper.convertValue(dsl.categoryMapping(), new TypeReference<Map<String, Object>>() {});

        List<BenchmarkCase> cases = new ArrayList<>();
        int next = 0;
        outer:
        for (Map.Entry<CaseDifficulty, Integer> bucket : plan.entrySet()) {
            CaseDifficulty difficulty = bucket.getKey();
            for (int i = 0; i < bucket.getValue(); i++) {
                if (cases.size() >= options.count()) break outer;
                Map<String, Object> combo = combos.get(next++ % combos.size());

                // The default material is rendered into the text but not expected.
                Map<String, Object> rendered = new LinkedHashMap<>(combo);
                if (defaultMaterial != null) rendered.putIfAbsent(MATERIAL, defaultMaterial);

                String text = templates.generate(rendered, difficulty, options.includeVariants());
                CaseSourceType source = CaseSourceType.TABLE_ENUM;
                if (options.includeNoise()) {
                    String noisy = noise.inject(text, difficulty);
                    if (!noisy.equals(text)) {
                        text = noisy;
                        source = CaseSourceType.NOISE;
                    }
                }

                BenchmarkCase c = new BenchmarkCase(dataset, Codes.caseCode("GEN"), text);
                c.setExpectedSkillId(skill.getSkillId());
                c.setExpectedAttributes(expectedFromSkill(combo, dsl));
                c.setExpectedCategory(expectedCategory);
                c.setDifficulty(difficulty);
                c.setSourceType(source);
                Object sourceRef = combo.get(ValueDomainExtractor.SOURCE_KEY);
                c.setSourceReference(sourceRef != null ? sourceRef.toString() : null);
                c.setTags(new ArrayList<>(List.of("generated", difficulty.key())));
                cases.add(c);

                byDifficulty.merge(difficulty.key(), 1, Integer::sum);
                bySource.merge(key(source), 1, Integer::sum);
            }
        }

        caseRepository.saveAll(cases);
        if (dataset.getSkill() == null) dataset.setSkill(skill);
        recordGenerated(dataset, byDifficulty);
        log.info("Generated {} cases for dataset {} from skill '{}' ({} combinations)",
                cases.size(), dataset.getDatasetCode(), skill.getSkillId(), combos.size());
        return new GenerationResult(cases.size(), byDifficulty, bySource, combos.size());
    }

    Map<String, Map<String, Object>> expectedFromSkill(Map<String, Object> combo, SkillDsl dsl) {
        Map<String, Map<String, Object>> expected = new LinkedHashMap<>();
        combo.forEach((name, value) -> {
            if (name.startsWith("_")) return;
            AttributeSpec spec = dsl.attributesOrEmpty().get(name);
            String unit = spec != null ? spec.unitOrBlank() : DEFAULT_UNITS.getOrDefault(name, "");
            Double tolerance = NUMERIC_ATTRIBUTES.contains(name) ? EvaluationConfig.DEFAULT_TOLERANCE : null;
            expected.put(name, new ExpectedAttribute(value, unit, tolerance).toMap());
        });
        return expected;
    }

    // ------------------------------------------------------------------
    // From a template
    // ------------------------------------------------------------------

    /**
     * Render a stored template over the cross product of {@code values}; at
     * most {@code count} cases, each expecting exactly the values it was
     * rendered from.
     */
    @Transactional
    public GenerationResult generateFromTemplate(UUID datasetId, UUID templateId,
                                                 Map<String, List<Object>> values, int count,
                                                 CaseDifficulty difficulty) {
        BenchmarkDataset dataset = writableDataset(datasetId);
        GenerationTemplate template = activeTemplate(templateId);
        NoiseInjector noise = new NoiseInjector(random, template.getNoiseRules());

        List<BenchmarkCase> cases = new ArrayList<>();
        for (Map<String, Object> combo : ValueDomainExtractor.crossProduct(values, count, random)) {
            BenchmarkCase c = new BenchmarkCase(dataset, Codes.caseCode("TPL"), renderTemplate(template, combo, noise, difficulty));
            Map<String, Map<String, Object>> expected = new LinkedHashMap<>();
            combo.forEach((k, v) -> expected.put(k, new ExpectedAttribute(v, "", null).toMap()));
            c.setExpectedAttributes(expected);
            c.setDifficulty(difficulty);
            c.setSourceType(CaseSourceType.TEMPLATE);
            c.setSourceReference("template:" + template.getTemplateCode());
            c.setTags(new ArrayList<>(List.of("template", difficulty.key())));
            cases.add(c);
        }
        caseRepository.saveAll(cases);

        Map<String, Integer> byDifficulty = new LinkedHashMap<>();
        byDifficulty.put(difficulty.key(), cases.size());
        recordGenerated(dataset, byDifficulty);
        log.info("Generated {} cases for dataset {} from template {}",
                cases.size(), dataset.getDatasetCode(), template.getTemplateCode());
        return new GenerationResult(cases.size(), byDifficulty,
                Map.of(key(CaseSourceType.TEMPLATE), cases.size()), cases.size());
    }

    /** Render template samples without storing anything. */
    @Transactional(readOnly = true)
    public List<String> previewTemplate(UUID templateId, Map<String, List<Object>> values, int count,
                                        CaseDifficulty difficulty) {
        GenerationTemplate template = templateRepository.findById(templateId)
                .orElseThrow(() -> new ResourceNotFoundException("GenerationTemplate", templateId));
        NoiseInjector noise = new NoiseInjector(random, template.getNoiseRules());
        List<String> samples = new ArrayList<>();
        for (Map<String, Object> combo : ValueDomainExtractor.crossProduct(values, count, random)) {
            samples.add(renderTemplate(template, combo, noise, difficulty));
        }
        return samples;
    }

    private String renderTemplate(GenerationTemplate template, Map<String, Object> combo,
                                  NoiseInjector noise, CaseDifficulty difficulty) {
        String pattern = template.getPattern();
        List<String> variants = template.getVariants();
        if (variants != null && !variants.isEmpty() && random.nextDouble() < TEMPLATE_VARIANT_PROBABILITY) {
            pattern = variants.get(random.nextInt(variants.size()));
        }
        return noise.inject(ExpressionTemplateEngine.render(pattern, combo), difficulty);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private BenchmarkDataset writableDataset(UUID datasetId) {
        BenchmarkDataset dataset = datasetRepository.findById(datasetId)
                .orElseThrow(() -> new ResourceNotFoundException("BenchmarkDataset", datasetId));
        if (dataset.getStatus() == DatasetStatus.ARCHIVED) {
            throw new BenchmarkException(BenchmarkException.Kind.DATASET_ARCHIVED,
                    "Dataset " + dataset.getDatasetCode() + " is archived");
        }
        return dataset;
    }

    private GenerationTemplate activeTemplate(UUID templateId) {
        GenerationTemplate template = templateRepository.findById(templateId)
                .orElseThrow(() -> new ResourceNotFoundException("GenerationTemplate", templateId));
        if (!template.isActive()) {
            throw new BenchmarkException(BenchmarkException.Kind.TEMPLATE_INACTIVE,
                    "Template " + template.getTemplateCode() + " is inactive");
        }
        return template;
    }

    /** Merges the new counts into the dataset's distribution and marks it ready. */
    private void recordGenerated(BenchmarkDataset dataset, Map<String, Integer> added) {
        boolean hadCases = dataset.getTotalCases() > 0;
        Map<String, Integer> dist = new LinkedHashMap<>(
                dataset.getDifficultyDistribution() == null ? Map.of() : dataset.getDifficultyDistribution());
        added.forEach((k, n) -> {
            if (n > 0) dist.merge(k, n, Integer::sum);
        });
        dataset.setDifficultyDistribution(dist);
        dataset.setTotalCases(dist.values().stream().mapToInt(Integer::intValue).sum());
        if (dataset.getSourceType() == DatasetSourceType.SEED) {
            dataset.setSourceType(hadCases ? DatasetSourceType.MIXED : DatasetSourceType.GENERATED);
        }
        if (dataset.getStatus() == DatasetStatus.DRAFT && dataset.getTotalCases() > 0) {
            dataset.setStatus(DatasetStatus.READY);
        }
        datasetRepository.save(dataset);
    }

    private static Map<String, Integer> emptyCounts(Enum<?>[] values) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Enum<?> v : values) counts.put(key(v), 0);
        return counts;
    }

    private static String key(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
