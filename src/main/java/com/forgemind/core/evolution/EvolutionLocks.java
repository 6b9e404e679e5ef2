package com.forgemind.core.evolution;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One evolution lock per behavior id. Holding the lock means an evolution job owns the
 * behavior: no second job starts and lifecycle promotion fails fast.
 */
@Component
public class EvolutionLocks {

    private final ConcurrentHashMap<String, String> holders = new ConcurrentHashMap<>();

    public boolean tryAcquire(String behaviorId, String jobId) {
        return holders.putIfAbsent(behaviorId, jobId) == null;
    }

    /** Releases the lock only if {@code jobId} still holds it. */
    public void release(String behaviorId, String jobId) {
        holders.remove(behaviorId, jobId);
    }

    public boolean isLocked(String behaviorId) {
        return holders.containsKey(behaviorId);
    }

    public Optional<String> holder(String behaviorId) {
        return Optional.ofNullable(holders.get(behaviorId));
    }
}
