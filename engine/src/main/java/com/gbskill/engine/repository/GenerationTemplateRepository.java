package com.gbskill.engine.repository;

import com.gbskill.engine.model.GenerationTemplate;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface GenerationTemplateRepository extends JpaRepository<GenerationTemplate, UUID> {

    boolean existsByTemplateCode(String templateCode);

    List<GenerationTemplate> findByActiveTrueOrderByTemplateCodeAsc();
}
