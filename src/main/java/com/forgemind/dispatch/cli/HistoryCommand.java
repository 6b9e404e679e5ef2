package com.forgemind.dispatch.cli;

import com.forgemind.core.evolution.EvolutionService;
import com.forgemind.core.model.EvolutionRunRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: forgemind history &lt;behaviorId&gt;
 * <p>
 * Lists past evolution runs, newest first.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List evolution runs of a behavior")
@Component
public class HistoryCommand implements Runnable {

    @Parameters(index = "0", description = "Behavior id")
    private String behaviorId;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final EvolutionService evolutionService;

    public HistoryCommand(EvolutionService evolutionService) {
        this.evolutionService = evolutionService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<EvolutionRunRecord> runs = evolutionService.getEvolutionHistory(behaviorId, limit);
        if (runs.isEmpty()) {
            ConsoleOutput.info("No evolution runs for " + behaviorId + ".");
            return;
        }
        ConsoleOutput.info("Evolution runs of " + behaviorId + " (" + runs.size() + "):");
        System.out.println();
        System.out.printf("  %-14s %-15s %-16s %-5s %-7s %-7s %s%n",
                "JOB", "STATUS", "VERSION", "GENS", "BEST", "HOLDOUT", "TRIGGER");
        System.out.println("  " + "-".repeat(80));
        for (EvolutionRunRecord run : runs) {
            String versions = run.toVersion() != null ? run.fromVersion() + "->" + run.toVersion()
                    : String.valueOf(run.fromVersion());
            System.out.printf("  %-14s %-15s %-16s %-5d %-7.3f %-7.3f %s%n", run.jobId(), run.status(),
                    versions, run.generationsRun(), run.bestFitness(), run.holdoutFitness(),
                    ConsoleOutput.truncate(run.triggerReason(), 28));
        }
    }
}
