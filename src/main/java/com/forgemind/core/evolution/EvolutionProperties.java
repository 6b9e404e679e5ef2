package com.forgemind.core.evolution;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Genetic-algorithm, job and fitness settings under {@code forgemind.evolution}.
 * <p>
 * {@code seed} makes selection, mutation choice and train/holdout splits reproducible;
 * leave it unset for a fresh seed per run.
 */
@Component
@ConfigurationProperties(prefix = "forgemind.evolution")
public class EvolutionProperties {

    private int populationSize = 8;
    private int eliteCount = 2;
    private int eliteValidationCount = 3;
    private double mutationRate = 0.7;
    private double crossoverRate = 0.3;
    private int tournamentSize = 3;
    private int maxGenerations = 10;
    private double targetFitness = 0.95;
    private int earlyStopGenerations = 3;
    private double trainRatio = 0.8;
    private double minImprovement = 0.0;
    private Long seed;
    private Duration generationTimeout = Duration.ofMinutes(10);
    private Duration jobTimeout = Duration.ofHours(1);
    private int jobThreads = 2;
    private int evaluationThreads = 4;
    private int retainedJobs = 100;
    private Fitness fitness = new Fitness();
    private Overfit overfit = new Overfit();

    public int getPopulationSize() {
        return populationSize;
    }

    public void setPopulationSize(int populationSize) {
        this.populationSize = populationSize;
    }

    public int getEliteCount() {
        return eliteCount;
    }

    public void setEliteCount(int eliteCount) {
        this.eliteCount = eliteCount;
    }

    public int getEliteValidationCount() {
        return eliteValidationCount;
    }

    public void setEliteValidationCount(int eliteValidationCount) {
        this.eliteValidationCount = eliteValidationCount;
    }

    public double getMutationRate() {
        return mutationRate;
    }

    public void setMutationRate(double mutationRate) {
        this.mutationRate = mutationRate;
    }

    public double getCrossoverRate() {
        return crossoverRate;
    }

    public void setCrossoverRate(double crossoverRate) {
        this.crossoverRate = crossoverRate;
    }

    public int getTournamentSize() {
        return tournamentSize;
    }

    public void setTournamentSize(int tournamentSize) {
        this.tournamentSize = tournamentSize;
    }

    public int getMaxGenerations() {
        return maxGenerations;
    }

    public void setMaxGenerations(int maxGenerations) {
        this.maxGenerations = maxGenerations;
    }

    public double getTargetFitness() {
        return targetFitness;
    }

    public void setTargetFitness(double targetFitness) {
        this.targetFitness = targetFitness;
    }

    public int getEarlyStopGenerations() {
        return earlyStopGenerations;
    }

    public void setEarlyStopGenerations(int earlyStopGenerations) {
        this.earlyStopGenerations = earlyStopGenerations;
    }

    public double getTrainRatio() {
        return trainRatio;
    }

    public void setTrainRatio(double trainRatio) {
        this.trainRatio = trainRatio;
    }

    public double getMinImprovement() {
        return minImprovement;
    }

    public void setMinImprovement(double minImprovement) {
        this.minImprovement = minImprovement;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public Duration getGenerationTimeout() {
        return generationTimeout;
    }

    public void setGenerationTimeout(Duration generationTimeout) {
        this.generationTimeout = generationTimeout;
    }

    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public void setJobTimeout(Duration jobTimeout) {
        this.jobTimeout = jobTimeout;
    }

    public int getJobThreads() {
        return jobThreads;
    }

    public void setJobThreads(int jobThreads) {
        this.jobThreads = jobThreads;
    }

    public int getEvaluationThreads() {
        return evaluationThreads;
    }

    public void setEvaluationThreads(int evaluationThreads) {
        this.evaluationThreads = evaluationThreads;
    }

    public int getRetainedJobs() {
        return retainedJobs;
    }

    public void setRetainedJobs(int retainedJobs) {
        this.retainedJobs = retainedJobs;
    }

    public Fitness getFitness() {
        return fitness;
    }

    public void setFitness(Fitness fitness) {
        this.fitness = fitness;
    }

    public Overfit getOverfit() {
        return overfit;
    }

    public void setOverfit(Overfit overfit) {
        this.overfit = overfit;
    }

    /**
     * Caps used to normalize efficiency, and the correctness score a case needs to pass.
     */
    public static class Fitness {

        private Duration latencyCap = Duration.ofSeconds(30);
        private long tokenCap = 4000;
        private double passThreshold = 0.7;

        public Duration getLatencyCap() {
            return latencyCap;
        }

        public void setLatencyCap(Duration latencyCap) {
            this.latencyCap = latencyCap;
        }

        public long getTokenCap() {
            return tokenCap;
        }

        public void setTokenCap(long tokenCap) {
            this.tokenCap = tokenCap;
        }

        public double getPassThreshold() {
            return passThreshold;
        }

        public void setPassThreshold(double passThreshold) {
            this.passThreshold = passThreshold;
        }
    }

    /**
     * Train/holdout gap thresholds and the window for the declining-holdout warning.
     */
    public static class Overfit {

        private double warnGap = 0.10;
        private double rejectGap = 0.20;
        private int trendWindow = 3;

        public double getWarnGap() {
            return warnGap;
        }

        public void setWarnGap(double warnGap) {
            this.warnGap = warnGap;
        }

        public double getRejectGap() {
            return rejectGap;
        }

        public void setRejectGap(double rejectGap) {
            this.rejectGap = rejectGap;
        }

        public int getTrendWindow() {
            return trendWindow;
        }

        public void setTrendWindow(int trendWindow) {
            this.trendWindow = trendWindow;
        }
    }
}
