package com.gbskill.engine.benchmark;

import com.gbskill.engine.TestSkills;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BenchmarkDataGeneratorTest {

    @Mock SkillRepository              skillRepo;
    @Mock BenchmarkDatasetRepository   datasetRepo;
    @Mock BenchmarkCaseRepository      caseRepo;
    @Mock GenerationTemplateRepository templateRepo;

    BenchmarkDataGenerator generator;
    BenchmarkDataset dataset;

    @BeforeEach
    void setUp() {
        generator = new BenchmarkDataGenerator(skillRepo, new SkillLoader(skillRepo, TestSkills.PARSER),
                datasetRepo, caseRepo, templateRepo, TestSkills.MAPPER, 42L);
        dataset = withId(new BenchmarkDataset("DS_GEN", "generated"));
    }

    // ------------------------------------------------------------------
    // generateFromSkill()
    // ------------------------------------------------------------------

    @Test
    void generateFromSkill_tableEnumeration_casesFollowDefaultSplit() {
        when(datasetRepo.findById(dataset.getId())).thenReturn(Optional.of(dataset));
        when(skillRepo.findBySkillId(TestSkills.PIPE_SKILL_ID)).thenReturn(Optional.of(TestSkills.pipeSkillEntity()));

        GenerationResult result = generator.generateFromSkill(dataset.getId(),
                new GenerationOptions(TestSkills.PIPE_SKILL_ID, 10, null, false, true));

        assertThat(result.generatedCount()).isEqualTo(10);
        assertThat(result.totalCombinations()).isEqualTo(5);
        assertThat(result.byDifficulty()).containsEntry("easy", 4)
                .containsEntry("medium", 3)
                .containsEntry("hard", 2)
                .containsEntry("adversarial", 1);
        assertThat(result.bySource()).containsEntry("table_enum", 10).containsEntry("noise", 0);

        List<BenchmarkCase> cases = savedCases();
        assertThat(cases).hasSize(10);
        BenchmarkCase first = cases.get(0);
        assertThat(first.getCaseCode()).startsWith("GEN_");
        assertThat(first.getDifficulty()).isEqualTo(CaseDifficulty.EASY);
        assertThat(first.getSourceType()).isEqualTo(CaseSourceType.TABLE_ENUM);
        assertThat(first.getSourceReference()).isEqualTo("dimension_table#row0:col2");
        assertThat(first.getExpectedSkillId()).isEqualTo(TestSkills.PIPE_SKILL_ID);
        assertThat(first.getTags()).containsExactly("generated", "easy");
        assertThat(first.getExpectedCategory()).containsEntry("categoryId", "01.02.03.04");
        assertThat(first.getExpectedAttributes().get("壁厚"))
                .containsEntry("value", 2.0)
                .containsEntry("unit", "mm")
                .containsEntry("tolerance", 0.05);
        assertThat(first.getExpectedAttributes()).doesNotContainKeys("材质", "_source", "公称压力");

        // five combinations reused round-robin
        assertThat(cases.get(5).getSourceReference()).isEqualTo(first.getSourceReference());
        assertThat(cases.get(9).getDifficulty()).isEqualTo(CaseDifficulty.ADVERSARIAL);
    }

    @Test
    void generateFromSkill_freshDataset_becomesReadyAndGenerated() {
        when(datasetRepo.findById(dataset.getId())).thenReturn(Optional.of(dataset));
        when(skillRepo.findBySkillId(TestSkills.PIPE_SKILL_ID)).thenReturn(Optional.of(TestSkills.pipeSkillEntity()));

        generator.generateFromSkill(dataset.getId(),
                new GenerationOptions(TestSkills.PIPE_SKILL_ID, 4, Map.of("easy", 50, "hard", 50), false, true));

        verify(datasetRepo).save(dataset);
        assertThat(dataset.getStatus()).isEqualTo(DatasetStatus.READY);
        assertThat(dataset.getSourceType()).isEqualTo(DatasetSourceType.GENERATED);
        assertThat(dataset.getTotalCases()).isEqualTo(4);
        assertThat(dataset.getDifficultyDistribution()).containsOnly(Map.entry("easy", 2), Map.entry("hard", 2));
        assertThat(dataset.getSkill().getSkillId()).isEqualTo(TestSkills.PIPE_SKILL_ID);
    }

    @Test
    void generateFromSkill_seededDataset_becomesMixed() {
        dataset.setTotalCases(3);
        dataset.setDifficultyDistribution(new LinkedHashMap<>(Map.of("medium", 3)));
        when(datasetRepo.findById(dataset.getId())).thenReturn(Optional.of(dataset));
        when(skillRepo.findBySkillId(TestSkills.PIPE_SKILL_ID)).thenReturn(Optional.of(TestSkills.pipeSkillEntity()));

        generator.generateFromSkill(dataset.getId(),
                new GenerationOptions(TestSkills.PIPE_SKILL_ID, 2, Map.of("medium", 100), false, true));

        assertThat(dataset.getSourceType()).isEqualTo(DatasetSourceType.MIXED);
        assertThat(dataset.getDifficultyDistribution()).containsEntry("medium", 5);
        assertThat(dataset.getTotalCases()).isEqualTo(5);
    }

    @Test
    void generateFromSkill_noTablesOrDomains_generatesNothing() {
        when(datasetRepo.findById(dataset.getId())).thenReturn(Optional.of(dataset));
        when(skillRepo.findBySkillId("empty")).thenReturn(Optional.of(new Skill("empty", "empty", "pipe", "{}")));

        GenerationResult result = generator.generateFromSkill(dataset.getId(),
                new GenerationOptions("empty", 5, null, true, true));

        assertThat(result.generatedCount()).isZero();
        verify(caseRepo, never()).saveAll(anyList());
        verify(datasetRepo, never()).save(any());
    }

    @Test
    void generateFromSkill_pnHeader_expectsPressureInMpa() {
        Skill skill = new Skill("skill_pn", "pn", "pipe", """
                {"tables": {"dimension_table": {
                   "columns": ["公称外径", "PN1.6壁厚"], "data": [[63, 3.0]]
                }}}
                """);
        when(datasetRepo.findById(dataset.getId())).thenReturn(Optional.of(dataset));
        when(skillRepo.findBySkillId("skill_pn")).thenReturn(Optional.of(skill));

        generator.generateFromSkill(dataset.getId(),
                new GenerationOptions("skill_pn", 1, Map.of("easy", 100), false, false));

        BenchmarkCase c = savedCases().get(0);
        assertThat(c.getSourceReference()).isEqualTo("dimension_table#row0:col1");
        assertThat(c.getExpectedAttributes().get("公称压力"))
                .containsEntry("value", 1.6)
                .containsEntry("unit", "MPa")
                .containsEntry("tolerance", 0.05);
    }

    @Test
    void generateFromSkill_valueDomainCombos_haveNoSourceReference() {
        Skill skill = new Skill("skill_enum", "enum", "pipe", """
                {"attributeExtraction": {
                   "材质":   {"type": "material", "allowedValues": ["PVC-U"]},
                   "公称直径": {"type": "dimension", "unit": "mm", "allowedValues": [50, 100]}
                }}
                """);
        when(datasetRepo.findById(dataset.getId())).thenReturn(Optional.of(dataset));
        when(skillRepo.findBySkillId("skill_enum")).thenReturn(Optional.of(skill));

        GenerationResult result = generator.generateFromSkill(dataset.getId(),
                new GenerationOptions("skill_enum", 2, Map.of("easy", 100), false, false));

        assertThat(result.totalCombinations()).isEqualTo(2);
        assertThat(savedCases()).hasSize(2).allSatisfy(c -> {
            assertThat(c.getSourceReference()).isNull();
            assertThat(c.getExpectedAttributes()).containsKeys("材质", "公称直径");
        });
    }

    @Test
    void generateFromSkill_unknownSkill_throwsNotFound() {
        when(datasetRepo.findById(dataset.getId())).thenReturn(Optional.of(dataset));
        when(skillRepo.findBySkillId("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> generator.generateFromSkill(dataset.getId(),
                new GenerationOptions("nope", 5, null, false, true)))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void generateFromSkill_archivedDataset_rejected() {
        dataset.setStatus(DatasetStatus.ARCHIVED);
        when(datasetRepo.findById(dataset.getId())).thenReturn(Optional.of(dataset));

        assertThatThrownBy(() -> generator.generateFromSkill(dataset.getId(),
                new GenerationOptions(TestSkills.PIPE_SKILL_ID, 5, null, false, true)))
                .isInstanceOfSatisfying(BenchmarkException.class,
                        e -> assertThat(e.getKind()).isEqualTo(BenchmarkException.Kind.DATASET_ARCHIVED));
        verifyNoInteractions(skillRepo, caseRepo);
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    @Test
    void generateFromTemplate_rendersEveryCombination() {
        GenerationTemplate template = withId(new GenerationTemplate("TPL_PIPE", "pipe", "{材质} DN{公称直径}"));
        when(datasetRepo.findById(dataset.getId())).thenReturn(Optional.of(dataset));
        when(templateRepo.findById(template.getId())).thenReturn(Optional.of(template));

        GenerationResult result = generator.generateFromTemplate(dataset.getId(), template.getId(),
                pipeValues(), 5, CaseDifficulty.EASY);

        assertThat(result.generatedCount()).isEqualTo(2);
        assertThat(result.bySource()).containsEntry("template", 2);
        List<BenchmarkCase> cases = savedCases();
        assertThat(cases).extracting(BenchmarkCase::getInputText).containsExactly("PVC-U DN50", "PVC-U DN100");
        assertThat(cases.get(1).getExpectedAttributes().get("公称直径")).containsEntry("value", 100);
        assertThat(cases.get(1).getSourceType()).isEqualTo(CaseSourceType.TEMPLATE);
        assertThat(cases.get(1).getSourceReference()).isEqualTo("template:TPL_PIPE");
        assertThat(dataset.getDifficultyDistribution()).containsEntry("easy", 2);
    }

    @Test
    void generateFromTemplate_inactiveTemplate_rejected() {
        GenerationTemplate template = withId(new GenerationTemplate("TPL_OLD", "old", "{材质}"));
        template.setActive(false);
        when(datasetRepo.findById(dataset.getId())).thenReturn(Optional.of(dataset));
        when(templateRepo.findById(template.getId())).thenReturn(Optional.of(template));

        assertThatThrownBy(() -> generator.generateFromTemplate(dataset.getId(), template.getId(),
                pipeValues(), 5, CaseDifficulty.EASY))
                .isInstanceOfSatisfying(BenchmarkException.class,
                        e -> assertThat(e.getKind()).isEqualTo(BenchmarkException.Kind.TEMPLATE_INACTIVE));
    }

    @Test
    void previewTemplate_returnsSamplesWithoutSaving() {
        GenerationTemplate template = withId(new GenerationTemplate("TPL_PIPE", "pipe", "{材质} DN{公称直径}"));
        when(templateRepo.findById(template.getId())).thenReturn(Optional.of(template));

        List<String> samples = generator.previewTemplate(template.getId(), pipeValues(), 1, CaseDifficulty.EASY);

        assertThat(samples).singleElement().satisfies(s -> assertThat(s).startsWith("PVC-U DN"));
        verifyNoInteractions(caseRepo, datasetRepo);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<BenchmarkCase> savedCases() {
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<BenchmarkCase>> captor = ArgumentCaptor.forClass(List.class);
        verify(caseRepo).saveAll(captor.capture());
        return captor.getValue();
    }

    private static Map<String, List<Object>> pipeValues() {
        Map<String, List<Object>> values = new LinkedHashMap<>();
        values.put("材质", List.of("PVC-U"));
        values.put("公称直径", List.of(50, 100));
        return values;
    }

    private static <T> T withId(T entity) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return entity;
    }
}
