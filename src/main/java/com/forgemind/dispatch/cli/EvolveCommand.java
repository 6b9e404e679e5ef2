package com.forgemind.dispatch.cli;

import com.forgemind.core.evolution.EvolutionJob;
import com.forgemind.core.evolution.EvolutionRequest;
import com.forgemind.core.evolution.EvolutionService;
import com.forgemind.core.events.EventBus;
import com.forgemind.core.events.ForgeEvent;
import com.forgemind.core.model.EvolutionResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: forgemind evolve &lt;behaviorId&gt;
 * <p>
 * Runs one evolution to completion, printing each generation as it finishes.
 */
@Command(name = "evolve", mixinStandardHelpOptions = true, description = "Evolve a behavior's instruction")
@Component
public class EvolveCommand implements Runnable {

    @Parameters(index = "0", description = "Behavior id")
    private String behaviorId;

    @Option(names = {"--action", "-a"}, description = "Action to evolve (default: chosen from failures)")
    private String actionName;

    @Option(names = {"--generations", "-g"}, description = "Maximum generations")
    private Integer maxGenerations;

    @Option(names = {"--target", "-t"}, description = "Target fitness in [0,1]")
    private Double targetFitness;

    @Option(names = "--seed", description = "Random seed for a reproducible run")
    private Long seed;

    private final EvolutionService evolutionService;
    private final EventBus eventBus;

    public EvolveCommand(EvolutionService evolutionService, EventBus eventBus) {
        this.evolutionService = evolutionService;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        EventBus.Subscription subscription = eventBus.subscribe(behaviorId, event -> {
            if (ForgeEvent.EVOLUTION_GENERATION.equals(event.eventType())) {
                ConsoleOutput.info("generation " + event.payload().get("generation") + " done, best-so-far "
                        + event.payload().get("bestSoFarFitness"));
            }
        });
        try {
            EvolutionJob job = evolutionService.evolveAsync(new EvolutionRequest(behaviorId, actionName,
                    maxGenerations, targetFitness, "manual", seed));
            ConsoleOutput.info("Evolution job " + job.jobId() + " started for " + behaviorId);
            EvolutionResult result = job.result().join();
            ConsoleOutput.evolutionResult(result);
        } finally {
            subscription.unsubscribe();
        }
    }
}
