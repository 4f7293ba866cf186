package com.gbskill.engine.repository;

import com.gbskill.engine.model.Skill;
import com.gbskill.engine.model.SkillStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + catalog queries for the skills table.
 */
public interface SkillRepository extends JpaRepository<Skill, UUID> {

    Optional<Skill> findBySkillId(String skillId);

    boolean existsBySkillId(String skillId);

    /** Match candidates, highest priority first. */
    List<Skill> findByStatusOrderByPriorityDesc(SkillStatus status);

    List<Skill> findAllByOrderByPriorityDesc();

    /** Catalog listing; either filter may be null. */
    @Query("""
            SELECT s FROM Skill s
            WHERE (:domain IS NULL OR s.domain = :domain)
              AND (:status IS NULL OR s.status = :status)
            ORDER BY s.priority DESC, s.skillId ASC
            """)
    List<Skill> search(@Param("domain") String domain, @Param("status") SkillStatus status);
}
