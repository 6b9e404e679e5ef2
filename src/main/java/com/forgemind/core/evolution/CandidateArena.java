package com.forgemind.core.evolution;

import com.forgemind.core.model.PromptCandidate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Every candidate of one evolution run, keyed by generation. Lineage is the parent-id DAG
 * recorded on each candidate. Confined to the thread running the evolution.
 */
public class CandidateArena {

    private final Map<Integer, List<String>> idsByGeneration = new TreeMap<>();
    private final Map<String, PromptCandidate> byId = new HashMap<>();
    private int sequence;

    public String nextId(int generation) {
        return "g" + generation + "-c" + (++sequence);
    }

    /** Adds a new candidate or replaces the stored state of an existing one. */
    public PromptCandidate put(PromptCandidate candidate) {
        if (byId.put(candidate.id(), candidate) == null) {
            idsByGeneration.computeIfAbsent(candidate.generation(), g -> new ArrayList<>()).add(candidate.id());
        }
        return candidate;
    }

    public Optional<PromptCandidate> get(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public List<PromptCandidate> generation(int generation) {
        return idsByGeneration.getOrDefault(generation, List.of()).stream().map(byId::get).toList();
    }

    public int size() {
        return byId.size();
    }

    /** Ids of all ancestors of {@code id}, nearest first. */
    public Set<String> lineage(String id) {
        Set<String> ancestors = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        get(id).ifPresent(c -> pending.addAll(c.parentIds()));
        while (!pending.isEmpty()) {
            String parent = pending.poll();
            if (ancestors.add(parent)) {
                get(parent).ifPresent(c -> pending.addAll(c.parentIds()));
            }
        }
        return ancestors;
    }
}
