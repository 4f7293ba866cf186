package com.gbskill.engine.runtime;

import com.gbskill.engine.dsl.CompiledSkill;
import com.gbskill.engine.dsl.DslParser;
import com.gbskill.engine.dsl.DslValidationException;
import com.gbskill.engine.dsl.SkillDsl;
import com.gbskill.engine.model.Skill;
import com.gbskill.engine.model.SkillStatus;
import com.gbskill.engine.repository.SkillRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns stored skills into {@link CompiledSkill}s.
 *
 * Skills are fetched and compiled on every call; nothing is cached. A skill
 * whose DSL fails validation is quarantined: skipped with a warning so the
 * remaining skills stay usable.
 */
@Component
public class SkillLoader {

    private static final Logger log = LoggerFactory.getLogger(SkillLoader.class);

    private final SkillRepository skillRepository;
    private final DslParser dslParser;

    public SkillLoader(SkillRepository skillRepository, DslParser dslParser) {
        this.skillRepository = skillRepository;
        this.dslParser = dslParser;
    }

    /**
     * Match candidates in descending priority: the ACTIVE skills, or every
     * skill when none is active.
     */
    public List<CompiledSkill> loadCandidates() {
        List<Skill> skills = skillRepository.findByStatusOrderByPriorityDesc(SkillStatus.ACTIVE);
        if (skills.isEmpty()) {
            skills = skillRepository.findAllByOrderByPriorityDesc();
        }
        List<CompiledSkill> compiled = new ArrayList<>(skills.size());
        for (Skill skill : skills) {
            try {
                compiled.add(compile(skill));
            } catch (DslValidationException e) {
                log.warn("Quarantined skill '{}' v{}: {}", skill.getSkillId(), skill.getDslVersion(), e.getMessage());
            }
        }
        return compiled;
    }

    /**
     * @throws DslValidationException if the skill's DSL is invalid
     */
    public CompiledSkill compile(Skill skill) {
        SkillDsl dsl = dslParser.parse(skill.getDslContent());
        return CompiledSkill.compile(skill.getSkillId(), skill.getSkillName(), skill.getDomain(),
                skill.getPriority(), skill.getDslVersion(), dsl);
    }
}
