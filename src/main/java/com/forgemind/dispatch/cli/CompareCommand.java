package com.forgemind.dispatch.cli;

import com.forgemind.core.evolution.EvolutionService;
import com.forgemind.core.model.VersionComparison;
import com.forgemind.core.model.VersionFitness;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: forgemind compare &lt;behaviorId&gt; &lt;versionA&gt; &lt;versionB&gt;
 */
@Command(name = "compare", mixinStandardHelpOptions = true, description = "Compare two versions of a behavior")
@Component
public class CompareCommand implements Runnable {

    @Parameters(index = "0", description = "Behavior id")
    private String behaviorId;

    @Parameters(index = "1", description = "First version")
    private String versionA;

    @Parameters(index = "2", description = "Second version")
    private String versionB;

    private final EvolutionService evolutionService;

    public CompareCommand(EvolutionService evolutionService) {
        this.evolutionService = evolutionService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        VersionComparison comparison = evolutionService.compareVersions(behaviorId, versionA, versionB);
        print(comparison.versionA());
        print(comparison.versionB());
        System.out.println();
        ConsoleOutput.info("Recommendation: " + comparison.recommendation() + " (" + comparison.rationale() + ")");
        if (!comparison.diff().isEmpty()) {
            System.out.println();
            ConsoleOutput.diff(comparison.diff());
        }
    }

    private static void print(VersionFitness v) {
        String evolved = v.evolvedFitness() != null ? String.format("%.3f", v.evolvedFitness()) : "-";
        System.out.printf("  %-10s executions %-6d success %-6.3f latency %-8.0f evolved %s%n",
                v.version(), v.executions(), v.successRate(), v.meanLatencyMs(), evolved);
    }
}
