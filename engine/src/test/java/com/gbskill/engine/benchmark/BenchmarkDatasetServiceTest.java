package com.gbskill.engine.benchmark;

import com.gbskill.engine.TestSkills;
import com.gbskill.engine.model.BenchmarkCase;
import com.gbskill.engine.model.BenchmarkDataset;
import com.gbskill.engine.model.CaseDifficulty;
import com.gbskill.engine.model.CaseSourceType;
import com.gbskill.engine.model.DatasetSourceType;
import com.gbskill.engine.model.DatasetStatus;
import com.gbskill.engine.model.GenerationTemplate;
import com.gbskill.engine.repository.BenchmarkCaseRepository;
import com.gbskill.engine.repository.BenchmarkDatasetRepository;
import com.gbskill.engine.repository.BenchmarkRunRepository;
import com.gbskill.engine.repository.GenerationTemplateRepository;
import com.gbskill.engine.repository.SkillRepository;
import com.gbskill.engine.service.DuplicateResourceException;
import com.gbskill.engine.service.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BenchmarkDatasetServiceTest {

    @Mock BenchmarkDatasetRepository   datasetRepo;
    @Mock BenchmarkCaseRepository      caseRepo;
    @Mock BenchmarkRunRepository       runRepo;
    @Mock GenerationTemplateRepository templateRepo;
    @Mock SkillRepository              skillRepo;

    BenchmarkDatasetService service;
    BenchmarkDataset dataset;

    @BeforeEach
    void setUp() {
        service = new BenchmarkDatasetService(datasetRepo, caseRepo, runRepo, templateRepo, skillRepo);
        dataset = new BenchmarkDataset("DS_SEED", "seed");
    }

    // ------------------------------------------------------------------
    // Datasets
    // ------------------------------------------------------------------

    @Test
    void createDataset_withSkill_draftDatasetLinkedToSkill() {
        when(datasetRepo.existsByDatasetCode("DS_PIPE")).thenReturn(false);
        when(skillRepo.findBySkillId(TestSkills.PIPE_SKILL_ID)).thenReturn(Optional.of(TestSkills.pipeSkillEntity()));

        BenchmarkDataset created = service.createDataset("DS_PIPE", "pipes", "desc", TestSkills.PIPE_SKILL_ID);

        assertThat(created.getStatus()).isEqualTo(DatasetStatus.DRAFT);
        assertThat(created.getSourceType()).isEqualTo(DatasetSourceType.SEED);
        assertThat(created.getSkill().getSkillId()).isEqualTo(TestSkills.PIPE_SKILL_ID);
        verify(datasetRepo).save(created);
    }

    @Test
    void createDataset_duplicateCode_throws() {
        when(datasetRepo.existsByDatasetCode("DS_PIPE")).thenReturn(true);

        assertThatThrownBy(() -> service.createDataset("DS_PIPE", "pipes", null, null))
                .isInstanceOfSatisfying(DuplicateResourceException.class,
                        e -> assertThat(e.getKey()).isEqualTo("DS_PIPE"));
        verify(datasetRepo, never()).save(any());
    }

    @Test
    void createDataset_unknownSkill_throwsNotFound() {
        when(datasetRepo.existsByDatasetCode("DS_PIPE")).thenReturn(false);
        when(skillRepo.findBySkillId("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.createDataset("DS_PIPE", "pipes", null, "nope"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void archiveDataset_setsArchived() {
        UUID id = UUID.randomUUID();
        when(datasetRepo.findById(id)).thenReturn(Optional.of(dataset));

        service.archiveDataset(id);

        assertThat(dataset.getStatus()).isEqualTo(DatasetStatus.ARCHIVED);
        verify(datasetRepo).save(dataset);
    }

    // ------------------------------------------------------------------
    // addCase()
    // ------------------------------------------------------------------

    @Test
    void addCase_normalizesExpectationsAndCountsCase() {
        UUID id = UUID.randomUUID();
        when(datasetRepo.findById(id)).thenReturn(Optional.of(dataset));

        BenchmarkCase c = service.addCase(id, new NewCase("  PVC-U给水管 DN100 PN1.6 ", TestSkills.PIPE_SKILL_ID,
                Map.of("公称直径", 100, "公称压力", Map.of("value", 1.6, "unit", "MPa")),
                null, null, List.of("regression")));

        assertThat(c.getInputText()).isEqualTo("PVC-U给水管 DN100 PN1.6");
        assertThat(c.getCaseCode()).startsWith("CASE_");
        assertThat(c.getDifficulty()).isEqualTo(CaseDifficulty.MEDIUM);
        assertThat(c.getSourceType()).isEqualTo(CaseSourceType.SEED);
        assertThat(c.getExpectedAttributes().get("公称直径")).containsExactly(Map.entry("value", 100));
        assertThat(c.getExpectedAttributes().get("公称压力")).containsEntry("unit", "MPa");
        assertThat(c.getTags()).containsExactly("regression");
        verify(caseRepo).save(c);

        assertThat(dataset.getTotalCases()).isEqualTo(1);
        assertThat(dataset.getDifficultyDistribution()).containsEntry("medium", 1);
        assertThat(dataset.getStatus()).isEqualTo(DatasetStatus.READY);
        assertThat(dataset.getSourceType()).isEqualTo(DatasetSourceType.SEED);
    }

    @Test
    void addCase_generatedDataset_becomesMixed() {
        UUID id = UUID.randomUUID();
        dataset.setSourceType(DatasetSourceType.GENERATED);
        when(datasetRepo.findById(id)).thenReturn(Optional.of(dataset));

        service.addCase(id, new NewCase("DN50", null, null, null, CaseDifficulty.HARD, null));

        assertThat(dataset.getSourceType()).isEqualTo(DatasetSourceType.MIXED);
        assertThat(dataset.getDifficultyDistribution()).containsEntry("hard", 1);
    }

    @Test
    void addCase_archivedDataset_rejected() {
        UUID id = UUID.randomUUID();
        dataset.setStatus(DatasetStatus.ARCHIVED);
        when(datasetRepo.findById(id)).thenReturn(Optional.of(dataset));

        assertThatThrownBy(() -> service.addCase(id, new NewCase("DN50", null, null, null, null, null)))
                .isInstanceOfSatisfying(BenchmarkException.class,
                        e -> assertThat(e.getKind()).isEqualTo(BenchmarkException.Kind.DATASET_ARCHIVED));
        verify(caseRepo, never()).save(any());
    }

    @Test
    void addCase_blankInput_rejected() {
        assertThatThrownBy(() -> service.addCase(UUID.randomUUID(), new NewCase(" ", null, null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    @Test
    void createTemplate_storesPatternAndVariants() {
        when(templateRepo.existsByTemplateCode("TPL_PIPE")).thenReturn(false);

        GenerationTemplate t = service.createTemplate("TPL_PIPE", "pipe", "pipe", "{材质}管 DN{公称直径}",
                List.of("DN{公称直径} {材质}"), Map.of("prefixes", List.of("询价")), null);

        assertThat(t.isActive()).isTrue();
        assertThat(t.getVariants()).containsExactly("DN{公称直径} {材质}");
        assertThat(t.getNoiseRules()).containsKey("prefixes");
        verify(templateRepo).save(t);
    }

    @Test
    void createTemplate_duplicateCode_throws() {
        when(templateRepo.existsByTemplateCode("TPL_PIPE")).thenReturn(true);

        assertThatThrownBy(() -> service.createTemplate("TPL_PIPE", "pipe", null, "{材质}", null, null, null))
                .isInstanceOf(DuplicateResourceException.class);
    }

    @Test
    void createTemplate_blankPattern_rejected() {
        when(templateRepo.existsByTemplateCode("TPL_X")).thenReturn(false);

        assertThatThrownBy(() -> service.createTemplate("TPL_X", "x", null, "", null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
