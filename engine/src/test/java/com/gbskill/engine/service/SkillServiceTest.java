package com.gbskill.engine.service;

import com.gbskill.engine.TestSkills;
import com.gbskill.engine.dsl.DslValidationException;
import com.gbskill.engine.model.Skill;
import com.gbskill.engine.model.SkillStatus;
import com.gbskill.engine.model.SkillVersion;
import com.gbskill.engine.repository.SkillRepository;
import com.gbskill.engine.repository.SkillVersionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SkillServiceTest {

    @Mock SkillRepository        skillRepo;
    @Mock SkillVersionRepository versionRepo;

    SkillService service;

    @BeforeEach
    void setUp() {
        service = new SkillService(skillRepo, versionRepo, TestSkills.PARSER);
    }

    // ------------------------------------------------------------------
    // create()
    // ------------------------------------------------------------------

    @Test
    void create_validDsl_draftSkillWithInitialVersion() {
        when(skillRepo.existsBySkillId(TestSkills.PIPE_SKILL_ID)).thenReturn(false);

        Skill skill = service.create(TestSkills.PIPE_SKILL_ID, "PVC-U给水管", "pipe", 120, TestSkills.pipeDslJson());

        assertThat(skill.getStatus()).isEqualTo(SkillStatus.DRAFT);
        assertThat(skill.getPriority()).isEqualTo(120);
        assertThat(skill.getDslVersion()).isEqualTo("1.0.0");
        assertThat(skill.getStandardCode()).isEqualTo("GB/T 10002.1-2006");
        verify(skillRepo).save(skill);

        ArgumentCaptor<SkillVersion> captor = ArgumentCaptor.forClass(SkillVersion.class);
        verify(versionRepo).save(captor.capture());
        assertThat(captor.getValue().getVersion()).isEqualTo("1.0.0");
        assertThat(captor.getValue().getChangeLog()).isEqualTo("Initial version");
        assertThat(captor.getValue().getDslContent()).isEqualTo(skill.getDslContent());
    }

    @Test
    void create_decodedJsonTree_storedAsNormalizedJson() {
        when(skillRepo.existsBySkillId("skill_min")).thenReturn(false);

        Skill skill = service.create("skill_min", "min", null, null,
                Map.of("intentRecognition", Map.of("keywords", List.of("阀"))));

        assertThat(TestSkills.PARSER.parse(skill.getDslContent()).intentRecognition().keywords())
                .containsExactly("阀");
    }

    @Test
    void create_duplicateSkillId_throws() {
        when(skillRepo.existsBySkillId(TestSkills.PIPE_SKILL_ID)).thenReturn(true);

        assertThatThrownBy(() -> service.create(TestSkills.PIPE_SKILL_ID, "x", null, null, "{}"))
                .isInstanceOf(DuplicateResourceException.class);
        verify(skillRepo, never()).save(any());
    }

    @Test
    void create_invalidDsl_nothingStored() {
        when(skillRepo.existsBySkillId("broken")).thenReturn(false);

        assertThatThrownBy(() -> service.create("broken", "broken", null, null, "{not json"))
                .isInstanceOf(DslValidationException.class);
        verify(skillRepo, never()).save(any());
        verify(versionRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // updateDsl()
    // ------------------------------------------------------------------

    @Test
    void updateDsl_bumpsPatchAndAppendsVersionRow_previousRowsUntouched() {
        Skill skill = TestSkills.pipeSkillEntity();
        when(skillRepo.findBySkillId(TestSkills.PIPE_SKILL_ID)).thenReturn(Optional.of(skill));

        service.updateDsl(TestSkills.PIPE_SKILL_ID,
                TestSkills.pipeDslJson().replace("GB/T 10002.1-2006", "GB/T 10002.1-2023"), "new edition");

        assertThat(skill.getDslVersion()).isEqualTo("1.0.1");
        assertThat(skill.getStandardCode()).isEqualTo("GB/T 10002.1-2023");
        ArgumentCaptor<SkillVersion> captor = ArgumentCaptor.forClass(SkillVersion.class);
        verify(versionRepo).save(captor.capture());
        assertThat(captor.getValue().getVersion()).isEqualTo("1.0.1");
        assertThat(captor.getValue().getChangeLog()).isEqualTo("new edition");
        assertThat(captor.getValue().getDslContent()).isEqualTo(skill.getDslContent());
        // history rows are append-only
        verify(versionRepo, never()).saveAll(any());
        verifyNoMoreInteractions(versionRepo);
    }

    @Test
    void updateDsl_unknownSkill_throwsNotFound() {
        when(skillRepo.findBySkillId("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.updateDsl("nope", "{}", null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Test
    void activateThenDeactivate() {
        Skill skill = TestSkills.pipeSkillEntity();
        when(skillRepo.findBySkillId(TestSkills.PIPE_SKILL_ID)).thenReturn(Optional.of(skill));

        assertThat(service.activate(TestSkills.PIPE_SKILL_ID).getStatus()).isEqualTo(SkillStatus.ACTIVE);
        assertThat(service.deactivate(TestSkills.PIPE_SKILL_ID).getStatus()).isEqualTo(SkillStatus.DEPRECATED);
    }

    @Test
    void bumpPatch_variants() {
        assertThat(SkillService.bumpPatch("1.0.9")).isEqualTo("1.0.10");
        assertThat(SkillService.bumpPatch("2.3")).isEqualTo("2.3.1");
        assertThat(SkillService.bumpPatch("v1")).isEqualTo("1.0.1");
        assertThat(SkillService.bumpPatch(null)).isEqualTo("1.0.1");
    }
}
