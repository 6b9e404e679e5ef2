package com.forgemind.core.overfit;

import com.forgemind.core.evolution.EvolutionProperties;
import com.forgemind.core.model.OverfitVerdict;
import com.forgemind.core.model.OverfitVerdict.Decision;
import com.forgemind.core.model.TestCase;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Train/holdout partitioning and overfit analysis.
 * <p>
 * A candidate whose train fitness exceeds its holdout fitness by {@code reject-gap} or
 * more is rejected; a gap of {@code warn-gap} or more is accepted with a warning.
 */
@Service
public class OverfitDetector {

    /** Absorbs floating-point noise so a gap of exactly 0.20 still rejects. */
    private static final double EPSILON = 1e-9;

    private final EvolutionProperties.Overfit settings;

    public OverfitDetector(EvolutionProperties properties) {
        this.settings = properties.getOverfit();
    }

    /**
     * Splits {@code cases} stratified by scenario type. Each scenario contributes
     * {@code round(size * trainRatio)} cases to train; a scenario with two or more cases
     * keeps at least one on each side, a singleton goes to train. When no scenario has
     * two cases, one case is still moved to holdout if there are at least two in total.
     */
    public TrainHoldoutSplit split(List<TestCase> cases, double trainRatio, Random random) {
        Map<String, List<TestCase>> byScenario = new LinkedHashMap<>();
        for (TestCase tc : cases) {
            byScenario.computeIfAbsent(tc.scenarioType(), k -> new ArrayList<>()).add(tc);
        }

        List<TestCase> train = new ArrayList<>();
        List<TestCase> holdout = new ArrayList<>();
        for (List<TestCase> group : byScenario.values()) {
            List<TestCase> shuffled = new ArrayList<>(group);
            Collections.shuffle(shuffled, random);
            int trainCount = (int) Math.round(shuffled.size() * trainRatio);
            if (shuffled.size() >= 2) {
                trainCount = Math.max(1, Math.min(shuffled.size() - 1, trainCount));
            } else {
                trainCount = shuffled.size();
            }
            train.addAll(shuffled.subList(0, trainCount));
            holdout.addAll(shuffled.subList(trainCount, shuffled.size()));
        }

        if (holdout.isEmpty() && train.size() >= 2) {
            holdout.add(train.remove(random.nextInt(train.size())));
        }
        return new TrainHoldoutSplit(train, holdout);
    }

    public OverfitVerdict detectOverfit(double trainFitness, double holdoutFitness) {
        double gap = trainFitness - holdoutFitness;
        Decision decision;
        if (gap >= settings.getRejectGap() - EPSILON) {
            decision = Decision.REJECT;
        } else if (gap >= settings.getWarnGap() - EPSILON) {
            decision = Decision.ACCEPT_WITH_WARNING;
        } else {
            decision = Decision.ACCEPT;
        }
        return new OverfitVerdict(decision, gap, trainFitness, holdoutFitness);
    }

    /**
     * True when the last {@code trend-window} holdout values are strictly decreasing.
     */
    public boolean decliningHoldoutTrend(List<Double> holdoutHistory) {
        int window = settings.getTrendWindow();
        if (window < 2 || holdoutHistory.size() < window) {
            return false;
        }
        List<Double> recent = holdoutHistory.subList(holdoutHistory.size() - window, holdoutHistory.size());
        for (int i = 1; i < recent.size(); i++) {
            if (recent.get(i) >= recent.get(i - 1)) {
                return false;
            }
        }
        return true;
    }
}
