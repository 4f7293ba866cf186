package com.gbskill.engine.api;

import com.gbskill.engine.api.dto.ExecutionLogResponse;
import com.gbskill.engine.api.dto.ParseRequest;
import com.gbskill.engine.runtime.MaterialParseResponse;
import com.gbskill.engine.runtime.SkillRuntime;
import com.gbskill.engine.service.ExecutionLogService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

/**
 * Single-description parsing.
 *
 * POST /api/v1/material-parse/single          : run the engine on one description
 * GET  /api/v1/material-parse/logs/{traceId}  : stored execution log of an earlier call
 */
@RestController
@RequestMapping("/api/v1/material-parse")
public class MaterialParseController {

    private final SkillRuntime        runtime;
    private final ExecutionLogService logService;

    public MaterialParseController(SkillRuntime runtime, ExecutionLogService logService) {
        this.runtime    = runtime;
        this.logService = logService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/api/v1/material-parse/single \
     *     -H "Content-Type: application/json" \
     *     -d '{"inputText":"PVC-U管 DN100 PN1.6"}'
     */
    @PostMapping("/single")
    public MaterialParseResponse parse(@Valid @RequestBody ParseRequest req) {
        return runtime.execute(req.inputText().strip(), req.traceId());
    }

    @GetMapping("/logs/{traceId}")
    public ExecutionLogResponse getLog(@PathVariable String traceId) {
        return ExecutionLogResponse.from(logService.getByTraceId(traceId));
    }
}
