package com.forgemind.dispatch.cli;

import com.forgemind.core.evolution.EvolutionService;
import com.forgemind.core.model.EvolutionJobStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: forgemind status [behaviorId]
 * <p>
 * Shows pending and running evolution jobs.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show active evolution jobs")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Behavior id (default: all)")
    private String behaviorId;

    private final EvolutionService evolutionService;

    public StatusCommand(EvolutionService evolutionService) {
        this.evolutionService = evolutionService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<EvolutionJobStatus> jobs = evolutionService.getEvolutionStatus(behaviorId);
        if (jobs.isEmpty()) {
            ConsoleOutput.info("No active evolution jobs.");
            return;
        }
        for (EvolutionJobStatus job : jobs) {
            String progress = job.currentGeneration() < 0 ? "waiting"
                    : String.format("generation %d, best %.3f", job.currentGeneration(), job.bestFitness());
            ConsoleOutput.info(job.jobId() + " " + job.behaviorId() + "." + job.actionName()
                    + " [" + job.state() + "] " + progress);
        }
    }
}
