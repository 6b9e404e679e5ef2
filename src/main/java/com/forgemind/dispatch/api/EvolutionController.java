package com.forgemind.dispatch.api;

import com.forgemind.core.evolution.EvolutionJob;
import com.forgemind.core.evolution.EvolutionRequest;
import com.forgemind.core.evolution.EvolutionService;
import com.forgemind.core.model.EvolutionDecision;
import com.forgemind.core.model.EvolutionJobStatus;
import com.forgemind.core.model.EvolutionRunRecord;
import com.forgemind.core.model.VersionComparison;
import com.forgemind.core.trigger.EvolutionTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for evolution runs, history and version comparison.
 */
@RestController
@RequestMapping("/api/v1/evolution")
public class EvolutionController {

    private static final Logger log = LoggerFactory.getLogger(EvolutionController.class);

    private final EvolutionService evolutionService;
    private final EvolutionTrigger evolutionTrigger;

    public EvolutionController(EvolutionService evolutionService, EvolutionTrigger evolutionTrigger) {
        this.evolutionService = evolutionService;
        this.evolutionTrigger = evolutionTrigger;
    }

    /**
     * POST /api/v1/evolution/{behaviorId}: Submit an evolution run. Returns 202 with the job
     * status, or 200 with the result when {@code wait=true}.
     */
    @PostMapping("/{behaviorId}")
    public ResponseEntity<?> evolve(@PathVariable String behaviorId,
                                    @RequestBody(required = false) EvolveRequest body,
                                    @RequestParam(defaultValue = "false") boolean wait) {
        EvolveRequest params = body != null ? body : new EvolveRequest(null, null, null, null);
        EvolutionRequest request = new EvolutionRequest(behaviorId, params.actionName(), params.maxGenerations(),
                params.targetFitness(), "manual", params.seed());
        EvolutionJob job = evolutionService.evolveAsync(request);
        log.info("Accepted evolution job {} for {}", job.jobId(), behaviorId);
        if (wait) {
            return ResponseEntity.ok(EvolveResponse.from(job.result().join()));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job.status());
    }

    /**
     * GET /api/v1/evolution/status: Pending and running jobs, optionally for one behavior.
     */
    @GetMapping("/status")
    public List<EvolutionJobStatus> status(@RequestParam(name = "behavior_id", required = false) String behaviorId) {
        return evolutionService.getEvolutionStatus(behaviorId);
    }

    @GetMapping("/{behaviorId}/history")
    public List<EvolutionRunRecord> history(@PathVariable String behaviorId,
                                            @RequestParam(defaultValue = "20") int limit) {
        return evolutionService.getEvolutionHistory(behaviorId, limit);
    }

    @GetMapping("/{behaviorId}/compare")
    public VersionComparison compare(@PathVariable String behaviorId,
                                     @RequestParam("a") String versionA,
                                     @RequestParam("b") String versionB) {
        return evolutionService.compareVersions(behaviorId, versionA, versionB);
    }

    @GetMapping("/{behaviorId}/should-evolve")
    public Map<String, Object> shouldEvolve(@PathVariable String behaviorId) {
        EvolutionDecision decision = evolutionTrigger.shouldEvolve(behaviorId);
        return Map.of("behavior_id", behaviorId, "should_evolve", decision.shouldEvolve(),
                "reason", decision.reason());
    }

    @GetMapping("/jobs/{jobId}")
    public EvolutionJobStatus job(@PathVariable String jobId) {
        return evolutionService.getJob(jobId);
    }

    @DeleteMapping("/jobs/{jobId}")
    public Map<String, Object> cancel(@PathVariable String jobId) {
        return Map.of("job_id", jobId, "cancelled", evolutionService.cancelEvolution(jobId));
    }
}
