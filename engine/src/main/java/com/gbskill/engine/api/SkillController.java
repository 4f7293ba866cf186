package com.gbskill.engine.api;

import com.gbskill.engine.api.dto.CreateSkillRequest;
import com.gbskill.engine.api.dto.SkillResponse;
import com.gbskill.engine.api.dto.SkillVersionResponse;
import com.gbskill.engine.api.dto.UpdateDslRequest;
import com.gbskill.engine.model.Skill;
import com.gbskill.engine.model.SkillStatus;
import com.gbskill.engine.model.SkillVersion;
import com.gbskill.engine.service.SkillService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Skill catalog.
 *
 * GET  /api/v1/skills                       : list, optionally by domain and status
 * GET  /api/v1/skills/{skillId}             : one skill with its DSL
 * POST /api/v1/skills                       : register a skill (DRAFT, v1.0.0)
 * PUT  /api/v1/skills/{skillId}/dsl         : replace the DSL, bumping the patch version
 * POST /api/v1/skills/{skillId}/activate    : make it a match candidate
 * POST /api/v1/skills/{skillId}/deactivate  : retire it
 * GET  /api/v1/skills/{skillId}/versions    : DSL history, newest first
 */
@RestController
@RequestMapping("/api/v1/skills")
public class SkillController {

    private final SkillService skillService;

    public SkillController(SkillService skillService) {
        this.skillService = skillService;
    }

    @GetMapping
    public List<SkillResponse> list(@RequestParam(required = false) String domain,
                                    @RequestParam(required = false) String status) {
        return skillService.list(domain, parseStatus(status)).stream()
                .map(SkillResponse::from)
                .toList();
    }

    @GetMapping("/{skillId}")
    public SkillResponse get(@PathVariable String skillId) {
        return SkillResponse.from(skillService.get(skillId));
    }

    @PostMapping
    public ResponseEntity<SkillResponse> create(@Valid @RequestBody CreateSkillRequest req) {
        Skill skill = skillService.create(req.skillId(), req.skillName(), req.domain(), req.priority(), req.dsl());
        return ResponseEntity.status(HttpStatus.CREATED).body(SkillResponse.from(skill));
    }

    @PutMapping("/{skillId}/dsl")
    public SkillResponse updateDsl(@PathVariable String skillId, @Valid @RequestBody UpdateDslRequest req) {
        return SkillResponse.from(skillService.updateDsl(skillId, req.dsl(), req.changeLog()));
    }

    @PostMapping("/{skillId}/activate")
    public SkillResponse activate(@PathVariable String skillId) {
        return SkillResponse.from(skillService.activate(skillId));
    }

    @PostMapping("/{skillId}/deactivate")
    public SkillResponse deactivate(@PathVariable String skillId) {
        return SkillResponse.from(skillService.deactivate(skillId));
    }

    @GetMapping("/{skillId}/versions")
    public List<SkillVersionResponse> versions(@PathVariable String skillId) {
        List<SkillVersion> history = skillService.versions(skillId);
        List<SkillVersionResponse> out = new ArrayList<>(history.size());
        for (int i = 0; i < history.size(); i++) {
            out.add(SkillVersionResponse.from(history.get(i), i == 0));
        }
        return out;
    }

    private static SkillStatus parseStatus(String status) {
        if (status == null || status.isBlank()) return null;
        try {
            return SkillStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown skill status: " + status);
        }
    }
}
