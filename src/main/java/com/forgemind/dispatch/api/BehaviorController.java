package com.forgemind.dispatch.api;

import com.forgemind.core.error.ValidationException;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.BehaviorTier;
import com.forgemind.core.model.LifecycleState;
import com.forgemind.core.model.TestCase;
import com.forgemind.core.model.TriggerKind;
import com.forgemind.core.registry.BehaviorFilter;
import com.forgemind.core.registry.BehaviorRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the behavior registry.
 */
@RestController
@RequestMapping("/api/v1/behaviors")
public class BehaviorController {

    private final BehaviorRegistry registry;

    public BehaviorController(BehaviorRegistry registry) {
        this.registry = registry;
    }

    /**
     * POST /api/v1/behaviors: Register a behavior in DRAFT.
     */
    @PostMapping
    public ResponseEntity<Behavior> register(@RequestBody BehaviorRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registry.register(request.toDefinition()));
    }

    @GetMapping
    public List<Behavior> list(@RequestParam(required = false) BehaviorTier tier,
                               @RequestParam(required = false) LifecycleState lifecycle,
                               @RequestParam(required = false) String domain) {
        return registry.list(new BehaviorFilter(tier, lifecycle, domain));
    }

    @GetMapping("/{id}")
    public Behavior get(@PathVariable String id) {
        return registry.get(id);
    }

    /**
     * GET /api/v1/behaviors/search?q=...: Rank behaviors by token overlap with the query.
     */
    @GetMapping("/search")
    public List<Behavior> search(@RequestParam("q") String query,
                                 @RequestParam(defaultValue = "10") int limit) {
        return registry.search(query, limit);
    }

    /**
     * GET /api/v1/behaviors/match?kind=COMMAND&probe=...: Non-retired behaviors whose triggers
     * match, highest priority first.
     */
    @GetMapping("/match")
    public List<Behavior> match(@RequestParam TriggerKind kind, @RequestParam String probe) {
        return registry.findByTrigger(kind, probe);
    }

    @PostMapping("/{id}/promote")
    public Behavior promote(@PathVariable String id, @RequestBody PromoteRequest request) {
        if (request.target() == null) {
            throw new ValidationException("target is required");
        }
        return registry.promote(id, request.target());
    }

    @PostMapping("/{id}/test-cases")
    public Behavior addTestCases(@PathVariable String id, @RequestBody List<TestCase> cases) {
        return registry.addTestCases(id, cases);
    }

    @PostMapping("/{id}/rollback-flag")
    public Behavior flagRollback(@PathVariable String id, @RequestBody RollbackRequest request) {
        return registry.flagRollback(id, request.reason());
    }

    @GetMapping("/{id}/versions")
    public List<Behavior> versions(@PathVariable String id) {
        return registry.versions(id);
    }

    @GetMapping("/{id}/versions/{version}")
    public Behavior version(@PathVariable String id, @PathVariable String version) {
        return registry.getVersion(id, version);
    }
}
