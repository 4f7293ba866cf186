package com.gbskill.engine.repository;

import com.gbskill.engine.model.SkillVersion;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SkillVersionRepository extends JpaRepository<SkillVersion, UUID> {

    /** Newest first. */
    List<SkillVersion> findBySkillIdOrderByCreatedAtDesc(UUID skillRef);
}
