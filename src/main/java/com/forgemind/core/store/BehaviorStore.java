package com.forgemind.core.store;

import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.EvolutionRunRecord;
import com.forgemind.core.model.ExecutionRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for behaviors, their version history, the execution ledger
 * and evolution run history.
 * <p>
 * Every saved behavior state is also kept as the snapshot of its version, so
 * {@link #loadVersion} returns the latest state recorded under that version.
 */
public interface BehaviorStore {

    /** Stores the current state of a behavior and returns its id. */
    String save(Behavior behavior);

    Optional<Behavior> load(String behaviorId);

    /** Behaviors ranked by token overlap of {@code query} with their searchable text. */
    List<Behavior> search(String query, int limit);

    /**
     * Appends an execution to the ledger.
     *
     * @return false when a record with the same execution id already exists
     */
    boolean recordExecution(ExecutionRecord record);

    /**
     * Replaces the current state only if its version still equals {@code expectedVersion}.
     *
     * @return false when the current version differs or the behavior does not exist
     */
    boolean compareAndSwap(String expectedVersion, Behavior behavior);

    Optional<Behavior> loadVersion(String behaviorId, String version);

    /** Version snapshots ordered from oldest to newest. */
    List<Behavior> listVersions(String behaviorId);

    List<Behavior> listAll();

    /** Ledger entries of a behavior in timestamp order; {@code since} may be null for all. */
    List<ExecutionRecord> executions(String behaviorId, Instant since);

    void saveEvolutionRun(EvolutionRunRecord run);

    /** Most recent runs first. */
    List<EvolutionRunRecord> evolutionRuns(String behaviorId, int limit);
}
