package com.forgemind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A versioned, executable procedure. Mutated only through the behavior registry;
 * every change produces a new immutable instance.
 *
 * @param id                      unique identifier
 * @param name                    human-readable name
 * @param description             what the behavior does
 * @param tier                    provenance tier
 * @param lifecycle               current lifecycle state
 * @param actions                 typed steps, unique by name
 * @param triggers                activation hints
 * @param domainTags              free-form domain labels used for filtering and search
 * @param version                 semantic version, bumped on every accepted evolution
 * @param generation              number of accepted evolutions so far
 * @param parentBehaviorId        lineage reference ({@code id@version}) of the predecessor, nullable
 * @param stats                   aggregate execution statistics
 * @param evolvable               false excludes the behavior from evolution
 * @param testCases               cases used for staging checks and fitness evaluation
 * @param styleConstraints        guidelines every evolved prompt must preserve
 * @param stagedAt                when the behavior entered STAGING, nullable
 * @param rollbackReason          non-null when a rollback has been flagged
 * @param consecutiveTestFailures failed staging attempts since the last success
 * @param lastEvolvedAt           last completed evolution run, nullable
 * @param createdAt               first registration
 * @param updatedAt               last change
 */
public record Behavior(
    String id,
    String name,
    String description,
    BehaviorTier tier,
    LifecycleState lifecycle,
    List<Action> actions,
    List<Trigger> triggers,
    List<String> domainTags,
    String version,
    int generation,
    String parentBehaviorId,
    BehaviorStats stats,
    boolean evolvable,
    List<TestCase> testCases,
    List<String> styleConstraints,
    Instant stagedAt,
    String rollbackReason,
    int consecutiveTestFailures,
    Instant lastEvolvedAt,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public static final String INITIAL_VERSION = "1.0.0";

    public Behavior {
        actions = actions == null ? List.of() : List.copyOf(actions);
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        domainTags = domainTags == null ? List.of() : List.copyOf(domainTags);
        testCases = testCases == null ? List.of() : List.copyOf(testCases);
        styleConstraints = styleConstraints == null ? List.of() : List.copyOf(styleConstraints);
        stats = stats == null ? BehaviorStats.empty() : stats;
    }

    /**
     * Definition as supplied by a caller before registration. The registry fills in
     * lifecycle, version and timestamps.
     */
    public static Behavior definition(String id, String name, String description, BehaviorTier tier,
                                      List<Action> actions, List<Trigger> triggers, List<String> domainTags) {
        return new Behavior(id, name, description, tier, LifecycleState.DRAFT, actions, triggers, domainTags,
                INITIAL_VERSION, 0, null, BehaviorStats.empty(), true, List.of(), List.of(),
                null, null, 0, null, null, null);
    }

    public Optional<Action> action(String actionName) {
        return actions.stream().filter(a -> a.name().equals(actionName)).findFirst();
    }

    public List<TestCase> testCasesFor(String actionName) {
        return testCases.stream().filter(tc -> actionName.equals(tc.actionName())).toList();
    }

    public boolean rollbackFlagged() {
        return rollbackReason != null;
    }

    public Behavior withLifecycle(LifecycleState state, Instant now) {
        return new Behavior(id, name, description, tier, state, actions, triggers, domainTags, version,
                generation, parentBehaviorId, stats, evolvable, testCases, styleConstraints, stagedAt,
                rollbackReason, consecutiveTestFailures, lastEvolvedAt, createdAt, now);
    }

    public Behavior withStaging(Instant stagedAt, Instant now) {
        return new Behavior(id, name, description, tier, LifecycleState.STAGING, actions, triggers, domainTags,
                version, generation, parentBehaviorId, stats, evolvable, testCases, styleConstraints, stagedAt,
                null, 0, lastEvolvedAt, createdAt, now);
    }

    public Behavior withTestFailures(int failures, LifecycleState state, Instant now) {
        return new Behavior(id, name, description, tier, state, actions, triggers, domainTags, version,
                generation, parentBehaviorId, stats, evolvable, testCases, styleConstraints, stagedAt,
                rollbackReason, failures, lastEvolvedAt, createdAt, now);
    }

    public Behavior withStats(BehaviorStats newStats, Instant now) {
        return new Behavior(id, name, description, tier, lifecycle, actions, triggers, domainTags, version,
                generation, parentBehaviorId, newStats, evolvable, testCases, styleConstraints, stagedAt,
                rollbackReason, consecutiveTestFailures, lastEvolvedAt, createdAt, now);
    }

    public Behavior withTestCases(List<TestCase> cases, Instant now) {
        return new Behavior(id, name, description, tier, lifecycle, actions, triggers, domainTags, version,
                generation, parentBehaviorId, stats, evolvable, cases, styleConstraints, stagedAt,
                rollbackReason, consecutiveTestFailures, lastEvolvedAt, createdAt, now);
    }

    public Behavior withRollbackReason(String reason, Instant now) {
        return new Behavior(id, name, description, tier, lifecycle, actions, triggers, domainTags, version,
                generation, parentBehaviorId, stats, evolvable, testCases, styleConstraints, stagedAt,
                reason, consecutiveTestFailures, lastEvolvedAt, createdAt, now);
    }

    public Behavior withLastEvolvedAt(Instant evolvedAt) {
        return new Behavior(id, name, description, tier, lifecycle, actions, triggers, domainTags, version,
                generation, parentBehaviorId, stats, evolvable, testCases, styleConstraints, stagedAt,
                rollbackReason, consecutiveTestFailures, evolvedAt, createdAt, evolvedAt);
    }

    /** Registration stamp: DRAFT, initial version, generation 0. */
    public Behavior registeredAt(Instant now) {
        return new Behavior(id, name, description, tier, LifecycleState.DRAFT, actions, triggers, domainTags,
                INITIAL_VERSION, 0, parentBehaviorId, BehaviorStats.empty(), evolvable, testCases,
                styleConstraints, null, null, 0, null, now, now);
    }

    /**
     * Successor carrying an evolved instruction for one action, one minor version up.
     */
    public Behavior evolvedTo(String actionName, String instruction, Instant now) {
        List<Action> evolvedActions = actions.stream()
                .map(a -> a.name().equals(actionName) ? a.withInstruction(instruction) : a)
                .toList();
        return new Behavior(id, name, description, tier, lifecycle, evolvedActions, triggers, domainTags,
                SemanticVersion.parse(version).nextMinor().toString(), generation + 1, id + "@" + version,
                stats, evolvable, testCases, styleConstraints, stagedAt, rollbackReason,
                consecutiveTestFailures, now, createdAt, now);
    }
}
