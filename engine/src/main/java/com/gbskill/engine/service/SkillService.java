package com.gbskill.engine.service;

import com.gbskill.engine.dsl.DslParser;
import com.gbskill.engine.dsl.SkillDsl;
import com.gbskill.engine.model.Skill;
import com.gbskill.engine.model.SkillStatus;
import com.gbskill.engine.model.SkillVersion;
import com.gbskill.engine.repository.SkillRepository;
import com.gbskill.engine.repository.SkillVersionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Skill catalog: registration, DSL replacement and lifecycle.
 *
 * Every stored DSL has been parsed and validated first, so a skill can only
 * be quarantined at load time if its row was edited behind the service's back.
 * Each DSL change appends a {@link SkillVersion}; history rows are never
 * rewritten apart from their {@code active} flag.
 */
@Service
public class SkillService {

    private static final Logger log = LoggerFactory.getLogger(SkillService.class);

    static final String INITIAL_VERSION = "1.0.0";

    private final SkillRepository skillRepository;
    private final SkillVersionRepository versionRepository;
    private final DslParser dslParser;

    public SkillService(SkillRepository skillRepository,
                        SkillVersionRepository versionRepository,
                        DslParser dslParser) {
        this.skillRepository = skillRepository;
        this.versionRepository = versionRepository;
        this.dslParser = dslParser;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** Either filter may be null. Highest priority first. */
    @Transactional(readOnly = true)
    public List<Skill> list(String domain, SkillStatus status) {
        return skillRepository.search(domain, status);
    }

    @Transactional(readOnly = true)
    public Skill get(String skillId) {
        return skillRepository.findBySkillId(skillId)
                .orElseThrow(() -> new ResourceNotFoundException("Skill", skillId));
    }

    /** Newest first; the first entry is the current DSL. */
    @Transactional(readOnly = true)
    public List<SkillVersion> versions(String skillId) {
        return versionRepository.findBySkillIdOrderByCreatedAtDesc(get(skillId).getId());
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    /**
     * Register a DRAFT skill at version {@value #INITIAL_VERSION}.
     *
     * @param rawDsl   DSL as a JSON string or an already-decoded JSON tree
     * @param priority null keeps the default
     * @throws DuplicateResourceException if the skill id is taken
     * @throws com.gbskill.engine.dsl.DslValidationException if the DSL is invalid
     */
    @Transactional
    public Skill create(String skillId, String skillName, String domain, Integer priority, Object rawDsl) {
        if (skillRepository.existsBySkillId(skillId)) {
            throw new DuplicateResourceException("Skill", skillId);
        }
        String dslContent = dslParser.normalize(rawDsl);
        SkillDsl dsl = dslParser.parse(dslContent);

        Skill skill = new Skill(skillId, skillName, domain, dslContent);
        if (priority != null) skill.setPriority(priority);
        skill.setStandardCode(dsl.standardCode());
        skill.setDslVersion(INITIAL_VERSION);
        skillRepository.save(skill);
        versionRepository.save(new SkillVersion(skill, INITIAL_VERSION, dslContent, "Initial version"));

        log.info("Created skill '{}' v{}", skillId, INITIAL_VERSION);
        return skill;
    }

    /**
     * Replace a skill's DSL, bumping the patch version.
     *
     * @throws com.gbskill.engine.dsl.DslValidationException if the DSL is invalid; nothing is stored
     */
    @Transactional
    public Skill updateDsl(String skillId, Object rawDsl, String changeLog) {
        Skill skill = get(skillId);
        String dslContent = dslParser.normalize(rawDsl);
        SkillDsl dsl = dslParser.parse(dslContent);
        String version = bumpPatch(skill.getDslVersion());

        versionRepository.save(new SkillVersion(skill, version, dslContent, changeLog));

        skill.setDslContent(dslContent);
        skill.setDslVersion(version);
        if (dsl.standardCode() != null) skill.setStandardCode(dsl.standardCode());
        skillRepository.save(skill);

        log.info("Updated skill '{}' to v{}", skillId, version);
        return skill;
    }

    @Transactional
    public Skill activate(String skillId) {
        return transition(skillId, SkillStatus.ACTIVE);
    }

    @Transactional
    public Skill deactivate(String skillId) {
        return transition(skillId, SkillStatus.DEPRECATED);
    }

    private Skill transition(String skillId, SkillStatus target) {
        Skill skill = get(skillId);
        SkillStatus from = skill.getStatus();
        skill.setStatus(target);
        skillRepository.save(skill);
        log.info("Skill '{}' {} -> {}", skillId, from, target);
        return skill;
    }

    /** {@code 1.0.9 → 1.0.10}; anything that is not dotted numbers restarts the history at 1.0.1. */
    static String bumpPatch(String version) {
        if (version == null || !version.matches("\\d+(\\.\\d+)*")) {
            return "1.0.1";
        }
        String[] parts = version.split("\\.");
        if (parts.length < 3) {
            String[] padded = {"0", "0", "0"};
            System.arraycopy(parts, 0, padded, 0, parts.length);
            parts = padded;
        }
        parts[parts.length - 1] = String.valueOf(Long.parseLong(parts[parts.length - 1]) + 1);
        return String.join(".", parts);
    }
}
