package com.forgemind.core.evolution;

import com.forgemind.core.model.PromptCandidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Fitness-weighted tournament selection: draw {@code tournamentSize} distinct candidates,
 * then pick one of them with probability proportional to its train fitness.
 */
public final class TournamentSelector {

    /** Keeps zero-fitness candidates selectable. */
    private static final double FLOOR = 1e-6;

    private TournamentSelector() {}

    public static PromptCandidate select(List<PromptCandidate> pool, int tournamentSize, Random random) {
        if (pool.isEmpty()) {
            throw new IllegalArgumentException("Cannot select from an empty pool");
        }
        List<PromptCandidate> contenders = new ArrayList<>(pool);
        Collections.shuffle(contenders, random);
        contenders = contenders.subList(0, Math.max(1, Math.min(tournamentSize, contenders.size())));

        double total = 0.0;
        for (PromptCandidate c : contenders) {
            total += c.fitnessOrZero() + FLOOR;
        }
        double r = random.nextDouble() * total;
        double cumulative = 0.0;
        for (PromptCandidate c : contenders) {
            cumulative += c.fitnessOrZero() + FLOOR;
            if (r < cumulative) {
                return c;
            }
        }
        return contenders.get(contenders.size() - 1);
    }
}
