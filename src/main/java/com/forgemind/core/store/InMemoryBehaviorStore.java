package com.forgemind.core.store;

import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.EvolutionRunRecord;
import com.forgemind.core.model.ExecutionRecord;
import com.forgemind.core.model.SemanticVersion;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Non-durable {@link BehaviorStore} for development, tests and the CLI.
 * State is lost on restart.
 */
public class InMemoryBehaviorStore implements BehaviorStore {

    private final ConcurrentHashMap<String, Behavior> current = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConcurrentSkipListMap<SemanticVersion, Behavior>> versions =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ExecutionRecord> executionsById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConcurrentLinkedQueue<ExecutionRecord>> ledger = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<EvolutionRunRecord>> runs = new ConcurrentHashMap<>();

    @Override
    public String save(Behavior behavior) {
        current.compute(behavior.id(), (id, existing) -> {
            snapshot(behavior);
            return behavior;
        });
        return behavior.id();
    }

    @Override
    public Optional<Behavior> load(String behaviorId) {
        return Optional.ofNullable(current.get(behaviorId));
    }

    @Override
    public List<Behavior> search(String query, int limit) {
        return BehaviorSearch.rank(current.values(), query, limit);
    }

    @Override
    public boolean recordExecution(ExecutionRecord record) {
        if (executionsById.putIfAbsent(record.executionId(), record) != null) {
            return false;
        }
        ledger.computeIfAbsent(record.behaviorId(), k -> new ConcurrentLinkedQueue<>()).add(record);
        return true;
    }

    @Override
    public boolean compareAndSwap(String expectedVersion, Behavior behavior) {
        AtomicBoolean swapped = new AtomicBoolean(false);
        current.computeIfPresent(behavior.id(), (id, existing) -> {
            if (!existing.version().equals(expectedVersion)) {
                return existing;
            }
            snapshot(behavior);
            swapped.set(true);
            return behavior;
        });
        return swapped.get();
    }

    @Override
    public Optional<Behavior> loadVersion(String behaviorId, String version) {
        Map<SemanticVersion, Behavior> history = versions.get(behaviorId);
        if (history == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(history.get(SemanticVersion.parse(version)));
    }

    @Override
    public List<Behavior> listVersions(String behaviorId) {
        Map<SemanticVersion, Behavior> history = versions.get(behaviorId);
        return history == null ? List.of() : List.copyOf(history.values());
    }

    @Override
    public List<Behavior> listAll() {
        return current.values().stream().sorted(Comparator.comparing(Behavior::id)).toList();
    }

    @Override
    public List<ExecutionRecord> executions(String behaviorId, Instant since) {
        var records = ledger.get(behaviorId);
        if (records == null) {
            return List.of();
        }
        return records.stream()
                .filter(r -> since == null || !r.timestamp().isBefore(since))
                .sorted(Comparator.comparing(ExecutionRecord::timestamp))
                .toList();
    }

    @Override
    public void saveEvolutionRun(EvolutionRunRecord run) {
        runs.computeIfAbsent(run.behaviorId(), k -> new CopyOnWriteArrayList<>()).add(run);
    }

    @Override
    public List<EvolutionRunRecord> evolutionRuns(String behaviorId, int limit) {
        var history = runs.get(behaviorId);
        if (history == null) {
            return List.of();
        }
        List<EvolutionRunRecord> newestFirst = new ArrayList<>(history);
        newestFirst.sort(Comparator.comparing(EvolutionRunRecord::finishedAt,
                Comparator.nullsFirst(Comparator.naturalOrder())).reversed());
        return newestFirst.stream().limit(Math.max(0, limit)).toList();
    }

    private void snapshot(Behavior behavior) {
        versions.computeIfAbsent(behavior.id(), k -> new ConcurrentSkipListMap<>())
                .put(SemanticVersion.parse(behavior.version()), behavior);
    }
}
