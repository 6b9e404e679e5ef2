package com.forgemind.core.evolution;

import com.forgemind.core.error.CollaboratorUnavailableException;
import com.forgemind.core.error.ConcurrencyException;
import com.forgemind.core.error.ValidationException;
import com.forgemind.core.fitness.FitnessEvaluator;
import com.forgemind.core.logging.MdcContext;
import com.forgemind.core.metrics.ForgemindMetrics;
import com.forgemind.core.model.Action;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.GenerationSummary;
import com.forgemind.core.model.EvolutionResult;
import com.forgemind.core.model.MutationStrategy;
import com.forgemind.core.model.OverfitVerdict;
import com.forgemind.core.model.PromptCandidate;
import com.forgemind.core.model.RunStatus;
import com.forgemind.core.model.TestCase;
import com.forgemind.core.mutation.MutationOutcome;
import com.forgemind.core.mutation.PromptMutator;
import com.forgemind.core.overfit.OverfitDetector;
import com.forgemind.core.overfit.TrainHoldoutSplit;
import com.forgemind.core.registry.BehaviorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Genetic-algorithm loop over the instruction of one action.
 * <p>
 * Each generation evaluates unevaluated candidates on the train partition, validates the top
 * elites on the holdout partition and drops those the overfit detector rejects. The best
 * validated candidate so far only changes on a strict train-fitness increase. A winner is
 * written back through {@link BehaviorRegistry#applyEvolvedPrompt} only when the run finished
 * normally and the winner beats the production prompt on train fitness.
 */
@Service
public class EvolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(EvolutionEngine.class);

    static final int MIN_TEST_CASES = 2;
    private static final Comparator<PromptCandidate> BY_TRAIN_DESC =
            Comparator.comparingDouble(PromptCandidate::fitnessOrZero).reversed();

    private final BehaviorRegistry registry;
    private final FitnessEvaluator evaluator;
    private final PromptMutator mutator;
    private final OverfitDetector overfitDetector;
    private final EvolutionProperties properties;
    private final ForgemindMetrics metrics;

    public EvolutionEngine(BehaviorRegistry registry, FitnessEvaluator evaluator, PromptMutator mutator,
                           OverfitDetector overfitDetector, EvolutionProperties properties,
                           ForgemindMetrics metrics) {
        this.registry = registry;
        this.evaluator = evaluator;
        this.mutator = mutator;
        this.overfitDetector = overfitDetector;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Runs evolution to completion, cancellation or deadline.
     *
     * @throws ValidationException when the behavior is not evolvable or the action has fewer than two test cases
     */
    public EvolutionResult run(String runId, EvolutionRequest request, CancellationToken token,
                               GenerationListener listener) {
        Behavior behavior = registry.get(request.behaviorId());
        if (!behavior.evolvable()) {
            throw new ValidationException("Behavior " + behavior.id() + " is not evolvable");
        }
        Action action = resolveAction(behavior, request.actionName());
        List<TestCase> cases = behavior.testCasesFor(action.name());
        if (cases.size() < MIN_TEST_CASES) {
            throw new ValidationException("Action " + action.name() + " of " + behavior.id() + " needs at least "
                    + MIN_TEST_CASES + " test cases to evolve, found " + cases.size());
        }

        long seed = request.seed() != null ? request.seed()
                : properties.getSeed() != null ? properties.getSeed() : System.nanoTime();
        Run run = new Run(runId, behavior, action, new Random(seed),
                request.maxGenerations() != null ? request.maxGenerations() : properties.getMaxGenerations(),
                request.targetFitness() != null ? request.targetFitness() : properties.getTargetFitness(),
                token, listener);
        run.split = overfitDetector.split(cases, properties.getTrainRatio(), run.random);
        log.info("Evolving {}.{} from {}: {} train / {} holdout cases, up to {} generations",
                behavior.id(), action.name(), behavior.version(), run.split.train().size(),
                run.split.holdout().size(), run.maxGenerations);

        RunStatus interrupted = null;
        try {
            evolve(run);
        } catch (EvolutionInterruptedException e) {
            interrupted = e.getStatus();
            run.warnings.add(e.getMessage());
            log.warn("Evolution of {} stopped early: {}", behavior.id(), e.getMessage());
        } catch (CollaboratorUnavailableException e) {
            interrupted = RunStatus.ABORTED;
            run.warnings.add(e.getMessage());
            log.error("Evolution of {} aborted: {}", behavior.id(), e.getMessage());
        } finally {
            MdcContext.clearGeneration();
        }
        return finish(run, interrupted);
    }

    static Action resolveAction(Behavior behavior, String actionName) {
        if (actionName != null) {
            return behavior.action(actionName).orElseThrow(() ->
                    new ValidationException("Behavior " + behavior.id() + " has no action " + actionName));
        }
        return behavior.actions().stream()
                .filter(a -> behavior.testCasesFor(a.name()).size() >= MIN_TEST_CASES)
                .findFirst()
                .orElseThrow(() -> new ValidationException("Behavior " + behavior.id()
                        + " has no action with at least " + MIN_TEST_CASES + " test cases"));
    }

    // ── generation loop ───────────────────────────────────────────

    private void evolve(Run run) {
        run.production = run.arena.put(PromptCandidate.seed(run.arena.nextId(0), run.action.instructionTemplate()));
        List<PromptCandidate> population = seedPopulation(run);

        for (int generation = 0; generation < run.maxGenerations; generation++) {
            run.token.checkpoint();
            MdcContext.setGeneration(generation);
            long started = System.currentTimeMillis();
            CancellationToken generationToken = run.token.child(properties.getGenerationTimeout());

            population = evaluateTrain(run, population, generationToken);
            population.sort(BY_TRAIN_DESC);
            double bestTrain = population.isEmpty() ? 0.0 : population.get(0).fitnessOrZero();

            int rejected = validateElites(run, population, generationToken);
            population.removeIf(PromptCandidate::rejected);

            Optional<PromptCandidate> generationBest = population.stream()
                    .filter(PromptCandidate::validated)
                    .max(Comparator.comparingDouble(PromptCandidate::fitnessOrZero));
            if (generationBest.isPresent() && (run.best == null
                    || generationBest.get().fitnessOrZero() > run.best.fitnessOrZero())) {
                run.best = generationBest.get();
                run.stagnant = 0;
            } else {
                run.stagnant++;
            }
            generationBest.ifPresent(c -> run.holdoutHistory.add(c.holdoutFitness()));
            if (overfitDetector.decliningHoldoutTrend(run.holdoutHistory)) {
                run.warnings.add("holdout fitness declined for " + properties.getOverfit().getTrendWindow()
                        + " consecutive generations at generation " + generation);
            }

            GenerationSummary summary = new GenerationSummary(generation, bestTrain,
                    run.best != null ? run.best.fitnessOrZero() : 0.0,
                    run.best != null && run.best.holdoutFitness() != null ? run.best.holdoutFitness() : 0.0,
                    population.size() + rejected, rejected, System.currentTimeMillis() - started);
            run.generations.add(summary);
            log.info("Generation {}: best train {} best-so-far {} ({} rejected)", generation,
                    String.format("%.3f", bestTrain), String.format("%.3f", summary.bestSoFarFitness()), rejected);
            run.listener.onGeneration(summary);

            if (run.best != null && run.best.fitnessOrZero() >= run.targetFitness) {
                log.info("Target fitness {} reached", run.targetFitness);
                return;
            }
            if (run.stagnant >= properties.getEarlyStopGenerations()) {
                log.info("No improvement for {} generations, stopping", run.stagnant);
                return;
            }
            if (generation + 1 < run.maxGenerations) {
                population = breed(run, population, generation + 1);
            }
        }
    }

    private List<PromptCandidate> seedPopulation(Run run) {
        List<PromptCandidate> population = new ArrayList<>();
        population.add(run.production);
        Set<String> prompts = new HashSet<>();
        prompts.add(run.production.prompt());
        int attempts = 0;
        while (population.size() < properties.getPopulationSize() && attempts++ < properties.getPopulationSize() * 2) {
            run.token.checkpoint();
            MutationStrategy strategy = mutator.chooseStrategy(run.random);
            Optional<MutationOutcome> outcome = mutator.mutate(run.production.prompt(), strategy, run.action,
                    run.behavior.styleConstraints());
            if (outcome.isPresent() && prompts.add(outcome.get().prompt())) {
                population.add(run.arena.put(new PromptCandidate(run.arena.nextId(0), outcome.get().prompt(), 0,
                        List.of(run.production.id()), List.of(strategy.name()),
                        outcome.get().changeDescription(), null, null, null)));
            }
        }
        return population;
    }

    private List<PromptCandidate> evaluateTrain(Run run, List<PromptCandidate> population, CancellationToken token) {
        List<PromptCandidate> evaluated = new ArrayList<>(population.size());
        for (PromptCandidate candidate : population) {
            if (candidate.evaluated()) {
                evaluated.add(candidate);
                continue;
            }
            token.checkpoint();
            double fitness;
            try {
                fitness = evaluator.evaluate(candidate.prompt(), run.action, run.split.train(), token).fitness();
            } catch (EvolutionInterruptedException | CollaboratorUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Candidate {} failed train evaluation: {}", candidate.id(), e.getMessage());
                fitness = 0.0;
            }
            metrics.recordCandidateFitness(fitness);
            PromptCandidate scored = run.arena.put(candidate.withTrainFitness(fitness));
            if (scored.id().equals(run.production.id())) {
                run.production = scored;
            }
            evaluated.add(scored);
        }
        return evaluated;
    }

    /** Validates the top elites in place; returns how many were rejected. */
    private int validateElites(Run run, List<PromptCandidate> sorted, CancellationToken token) {
        int rejected = 0;
        int limit = Math.min(properties.getEliteValidationCount(), sorted.size());
        for (int i = 0; i < limit; i++) {
            PromptCandidate candidate = sorted.get(i);
            if (!candidate.validated()) {
                token.checkpoint();
                double holdout;
                try {
                    holdout = evaluator.evaluate(candidate.prompt(), run.action, run.split.holdout(), token).fitness();
                } catch (EvolutionInterruptedException | CollaboratorUnavailableException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("Candidate {} failed holdout evaluation: {}", candidate.id(), e.getMessage());
                    holdout = 0.0;
                }
                OverfitVerdict verdict = overfitDetector.detectOverfit(candidate.fitnessOrZero(), holdout);
                candidate = run.arena.put(candidate.withValidation(holdout, verdict));
                sorted.set(i, candidate);
                if (candidate.id().equals(run.production.id())) {
                    run.production = candidate;
                }
                if (verdict.decision() == OverfitVerdict.Decision.ACCEPT_WITH_WARNING) {
                    run.warnings.add(String.format("candidate %s overfit warning: train %.3f holdout %.3f",
                            candidate.id(), verdict.trainFitness(), verdict.holdoutFitness()));
                }
            }
            if (candidate.rejected()) {
                rejected++;
                metrics.incrementOverfitRejections();
                run.warnings.add(String.format("candidate %s rejected as overfit: train %.3f holdout %.3f",
                        candidate.id(), candidate.verdict().trainFitness(), candidate.verdict().holdoutFitness()));
            }
        }
        return rejected;
    }

    private List<PromptCandidate> breed(Run run, List<PromptCandidate> survivors, int generation) {
        List<PromptCandidate> pool = survivors.isEmpty() ? List.of(run.production) : survivors;
        List<PromptCandidate> next = new ArrayList<>(pool.subList(0, Math.min(properties.getEliteCount(), pool.size())));
        Set<String> prompts = new HashSet<>();
        next.forEach(c -> prompts.add(c.prompt()));

        int attempts = 0;
        while (next.size() < properties.getPopulationSize() && attempts++ < properties.getPopulationSize() * 3) {
            run.token.checkpoint();
            Optional<PromptCandidate> child = run.random.nextDouble() < properties.getCrossoverRate() && pool.size() >= 2
                    ? crossoverChild(run, pool, generation)
                    : mutantChild(run, pool, generation);
            child.filter(c -> prompts.add(c.prompt())).ifPresent(c -> next.add(run.arena.put(c)));
        }
        return next;
    }

    private Optional<PromptCandidate> crossoverChild(Run run, List<PromptCandidate> pool, int generation) {
        PromptCandidate a = TournamentSelector.select(pool, properties.getTournamentSize(), run.random);
        PromptCandidate b = a;
        for (int i = 0; i < 3 && b.id().equals(a.id()); i++) {
            b = TournamentSelector.select(pool, properties.getTournamentSize(), run.random);
        }
        if (b.id().equals(a.id())) {
            return mutantChild(run, pool, generation);
        }
        Optional<MutationOutcome> crossed = mutator.crossover(a.prompt(), b.prompt(), run.action,
                run.behavior.styleConstraints());
        if (crossed.isEmpty()) {
            return Optional.empty();
        }
        List<String> operations = new ArrayList<>(List.of(PromptMutator.CROSSOVER));
        MutationOutcome outcome = crossed.get();
        if (run.random.nextDouble() < properties.getMutationRate()) {
            MutationStrategy strategy = mutator.chooseStrategy(run.random);
            Optional<MutationOutcome> mutated = mutator.mutate(outcome.prompt(), strategy, run.action,
                    run.behavior.styleConstraints());
            if (mutated.isPresent()) {
                outcome = new MutationOutcome(mutated.get().prompt(),
                        outcome.changeDescription() + "; " + mutated.get().changeDescription(), strategy.name());
                operations.add(strategy.name());
            }
        }
        return Optional.of(new PromptCandidate(run.arena.nextId(generation), outcome.prompt(), generation,
                List.of(a.id(), b.id()), operations, outcome.changeDescription(), null, null, null));
    }

    private Optional<PromptCandidate> mutantChild(Run run, List<PromptCandidate> pool, int generation) {
        PromptCandidate parent = TournamentSelector.select(pool, properties.getTournamentSize(), run.random);
        MutationStrategy strategy = mutator.chooseStrategy(run.random);
        return mutator.mutate(parent.prompt(), strategy, run.action, run.behavior.styleConstraints())
                .map(o -> new PromptCandidate(run.arena.nextId(generation), o.prompt(), generation,
                        List.of(parent.id()), List.of(strategy.name()), o.changeDescription(), null, null, null));
    }

    // ── result ────────────────────────────────────────────────────

    private EvolutionResult finish(Run run, RunStatus interrupted) {
        PromptCandidate production = run.production;
        double productionFitness = production != null ? production.fitnessOrZero() : 0.0;
        PromptCandidate winner = run.best;
        boolean beatsProduction = winner != null && production != null
                && !winner.id().equals(production.id())
                && production.evaluated()
                && winner.fitnessOrZero() > productionFitness + properties.getMinImprovement();

        RunStatus status = interrupted;
        String newVersion = null;
        boolean improved = false;
        if (status == null) {
            if (beatsProduction) {
                try {
                    newVersion = registry.applyEvolvedPrompt(run.behavior.id(), run.behavior.version(),
                            run.action.name(), winner.prompt(), winner.verdict()).version();
                    improved = true;
                    status = RunStatus.COMPLETED;
                } catch (ConcurrencyException e) {
                    run.warnings.add(e.getMessage());
                    status = RunStatus.FAILED;
                }
            } else {
                registry.recordEvolutionAttempt(run.behavior.id());
                status = RunStatus.NO_IMPROVEMENT;
            }
        }

        String bestPrompt = winner != null ? winner.prompt() : null;
        String diff = bestPrompt != null && !TextDiff.identical(run.action.instructionTemplate(), bestPrompt)
                ? TextDiff.lines(run.action.instructionTemplate(), bestPrompt)
                : "";
        log.info("Evolution of {}.{} finished {} (improved={}, best {}, production {}, {} candidates)",
                run.behavior.id(), run.action.name(), status, improved,
                String.format("%.3f", winner != null ? winner.fitnessOrZero() : 0.0),
                String.format("%.3f", productionFitness), run.arena.size());
        metrics.recordGenerations(run.generations.size());
        return new EvolutionResult(run.runId, run.behavior.id(), run.action.name(), status, improved,
                winner != null ? winner.fitnessOrZero() : 0.0,
                winner != null && winner.holdoutFitness() != null ? winner.holdoutFitness() : 0.0,
                productionFitness, run.generations.size(), diff, run.behavior.version(), newVersion,
                bestPrompt, new ArrayList<>(run.warnings), run.generations);
    }

    /** Mutable state of one run. */
    private static final class Run {
        final String runId;
        final Behavior behavior;
        final Action action;
        final Random random;
        final int maxGenerations;
        final double targetFitness;
        final CancellationToken token;
        final GenerationListener listener;
        final CandidateArena arena = new CandidateArena();
        final List<GenerationSummary> generations = new ArrayList<>();
        final Set<String> warnings = new LinkedHashSet<>();
        final List<Double> holdoutHistory = new ArrayList<>();
        TrainHoldoutSplit split;
        PromptCandidate production;
        PromptCandidate best;
        int stagnant;

        Run(String runId, Behavior behavior, Action action, Random random, int maxGenerations,
            double targetFitness, CancellationToken token, GenerationListener listener) {
            this.runId = runId;
            this.behavior = behavior;
            this.action = action;
            this.random = random;
            this.maxGenerations = maxGenerations;
            this.targetFitness = targetFitness;
            this.token = token;
            this.listener = listener != null ? listener : GenerationListener.NONE;
        }
    }
}
