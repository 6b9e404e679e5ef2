package com.forgemind.core.store;

import com.forgemind.core.Fixtures;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.EvolutionRunRecord;
import com.forgemind.core.model.ExecutionRecord;
import com.forgemind.core.model.GenerationSummary;
import com.forgemind.core.model.LifecycleState;
import com.forgemind.core.model.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior shared by every {@link BehaviorStore} implementation.
 */
abstract class BehaviorStoreContractTest {

    protected BehaviorStore store;

    protected abstract BehaviorStore createStore() throws Exception;

    @BeforeEach
    void setUpStore() throws Exception {
        store = createStore();
    }

    private static Behavior registered(String id) {
        return Fixtures.behaviorWithCases(id, 2).registeredAt(Fixtures.T0);
    }

    // ── behaviors ────────────────────────────────────────────────────

    @Test
    @DisplayName("save then load returns an equal behavior")
    void saveAndLoad() {
        Behavior behavior = registered("summarizer");
        assertEquals("summarizer", store.save(behavior));

        Behavior loaded = store.load("summarizer").orElseThrow();
        assertEquals(behavior, loaded);
        assertTrue(store.load("missing").isEmpty());
    }

    @Test
    @DisplayName("save overwrites the current state and the snapshot of the same version")
    void saveOverwrites() {
        Behavior behavior = registered("summarizer");
        store.save(behavior);
        store.save(behavior.withLifecycle(LifecycleState.TESTING, Fixtures.T0.plusSeconds(60)));

        assertEquals(LifecycleState.TESTING, store.load("summarizer").orElseThrow().lifecycle());
        assertEquals(1, store.listVersions("summarizer").size());
        assertEquals(LifecycleState.TESTING, store.loadVersion("summarizer", "1.0.0").orElseThrow().lifecycle());
    }

    @Test
    @DisplayName("compareAndSwap only replaces the expected version")
    void compareAndSwap() {
        Behavior behavior = registered("summarizer");
        store.save(behavior);
        Behavior evolved = behavior.evolvedTo("summarize", "Summarize tersely: {{query}}. Return answer.",
                Fixtures.T0.plusSeconds(60));

        assertFalse(store.compareAndSwap("0.9.0", evolved));
        assertTrue(store.compareAndSwap("1.0.0", evolved));
        assertFalse(store.compareAndSwap("1.0.0", evolved.evolvedTo("summarize", "Other", Fixtures.T0)));

        assertEquals("1.1.0", store.load("summarizer").orElseThrow().version());
        assertEquals(List.of("1.0.0", "1.1.0"),
                store.listVersions("summarizer").stream().map(Behavior::version).toList());
        assertEquals(Fixtures.SUMMARIZE_PROMPT, store.loadVersion("summarizer", "1.0.0").orElseThrow()
                .action("summarize").orElseThrow().instructionTemplate());
    }

    @Test
    @DisplayName("compareAndSwap of an unknown behavior fails")
    void compareAndSwapUnknown() {
        assertFalse(store.compareAndSwap("1.0.0", registered("ghost")));
        assertTrue(store.load("ghost").isEmpty());
    }

    @Test
    @DisplayName("listAll is ordered by id")
    void listAll() {
        store.save(registered("zeta"));
        store.save(registered("alpha"));

        assertEquals(List.of("alpha", "zeta"), store.listAll().stream().map(Behavior::id).toList());
    }

    @Test
    @DisplayName("search ranks name matches above tag matches")
    void search() {
        Behavior byName = Behavior.definition("report-writer", "Report writer", "Writes status updates",
                Fixtures.behavior("x").tier(), List.of(Fixtures.summarize()), List.of(), List.of("status"))
                .registeredAt(Fixtures.T0);
        Behavior byTag = Behavior.definition("notes", "Notes", "Keeps notes",
                Fixtures.behavior("x").tier(), List.of(Fixtures.summarize()), List.of(), List.of("report"))
                .registeredAt(Fixtures.T0);
        store.save(byTag);
        store.save(byName);
        store.save(registered("summarizer"));

        List<Behavior> hits = store.search("report", 10);

        assertEquals(List.of("report-writer", "notes"), hits.stream().map(Behavior::id).toList());
        assertEquals(1, store.search("report", 1).size());
        assertTrue(store.search("   ", 10).isEmpty());
    }

    // ── executions ───────────────────────────────────────────────────

    @Test
    @DisplayName("recordExecution is idempotent on the execution id")
    void recordExecutionIdempotent() {
        ExecutionRecord record = Fixtures.execution("e-1", "summarizer", true, Fixtures.T0);

        assertTrue(store.recordExecution(record));
        assertFalse(store.recordExecution(record));
        assertEquals(1, store.executions("summarizer", null).size());
    }

    @Test
    @DisplayName("executions are filtered by time and returned in timestamp order")
    void executionsInOrder() {
        store.recordExecution(Fixtures.execution("e-3", "summarizer", true, Fixtures.T0.plusSeconds(30)));
        store.recordExecution(Fixtures.execution("e-1", "summarizer", false, Fixtures.T0.minus(Duration.ofDays(2))));
        store.recordExecution(Fixtures.execution("e-2", "summarizer", true, Fixtures.T0));
        store.recordExecution(Fixtures.execution("e-9", "other", true, Fixtures.T0));

        List<ExecutionRecord> recent = store.executions("summarizer", Fixtures.T0.minus(Duration.ofDays(1)));

        assertEquals(List.of("e-2", "e-3"), recent.stream().map(ExecutionRecord::executionId).toList());
        assertEquals(3, store.executions("summarizer", null).size());
        assertEquals("weekly report e-2", recent.get(0).input().get("query"));
    }

    // ── evolution runs ───────────────────────────────────────────────

    @Test
    @DisplayName("evolution runs come back newest first, limited")
    void evolutionRuns() {
        store.saveEvolutionRun(run("run-1", Fixtures.T0));
        store.saveEvolutionRun(run("run-3", Fixtures.T0.plusSeconds(600)));
        store.saveEvolutionRun(run("run-2", Fixtures.T0.plusSeconds(300)));

        List<EvolutionRunRecord> runs = store.evolutionRuns("summarizer", 2);

        assertEquals(List.of("run-3", "run-2"), runs.stream().map(EvolutionRunRecord::runId).toList());
        assertEquals(1, runs.get(0).generations().size());
        assertEquals(RunStatus.COMPLETED, runs.get(0).status());
        assertTrue(store.evolutionRuns("other", 5).isEmpty());
    }

    private static EvolutionRunRecord run(String runId, Instant finishedAt) {
        return new EvolutionRunRecord(runId, "job-" + runId, "summarizer", "summarize", "manual",
                RunStatus.COMPLETED, true, "1.0.0", "1.1.0", 1, 0.89, 0.87, 0.70, "+ new line",
                List.of(), List.of(new GenerationSummary(0, 0.89, 0.89, 0.87, 6, 0, 1200)),
                finishedAt.minusSeconds(60), finishedAt);
    }
}
