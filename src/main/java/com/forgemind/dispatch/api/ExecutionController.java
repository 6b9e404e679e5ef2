package com.forgemind.dispatch.api;

import com.forgemind.core.model.FailurePattern;
import com.forgemind.core.tracking.ExecutionTracker;
import com.forgemind.core.tracking.SuccessRate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the execution ledger.
 */
@RestController
@RequestMapping("/api/v1/executions")
public class ExecutionController {

    private final ExecutionTracker tracker;

    public ExecutionController(ExecutionTracker tracker) {
        this.tracker = tracker;
    }

    /**
     * POST /api/v1/executions: Append an execution. 201 when recorded, 200 for a duplicate id.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> record(@RequestBody ExecutionRequest request) {
        boolean recorded = tracker.record(request.toRecord());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("execution_id", request.executionId());
        body.put("recorded", recorded);
        return ResponseEntity.status(recorded ? HttpStatus.CREATED : HttpStatus.OK).body(body);
    }

    /**
     * GET /api/v1/executions/{behaviorId}/success-rate?window=P30D
     */
    @GetMapping("/{behaviorId}/success-rate")
    public Map<String, Object> successRate(@PathVariable String behaviorId,
                                           @RequestParam(defaultValue = "P30D") Duration window) {
        SuccessRate rate = tracker.successRate(behaviorId, window);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("behavior_id", behaviorId);
        body.put("window", window.toString());
        body.put("successes", rate.successes());
        body.put("total", rate.total());
        body.put("rate", rate.rate());
        return body;
    }

    @GetMapping("/{behaviorId}/failure-patterns")
    public List<FailurePattern> failurePatterns(@PathVariable String behaviorId,
                                                @RequestParam(defaultValue = "10") int limit) {
        return tracker.failurePatterns(behaviorId, limit);
    }
}
