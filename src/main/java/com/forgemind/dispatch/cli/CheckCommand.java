package com.forgemind.dispatch.cli;

import com.forgemind.core.evolution.EvolutionJob;
import com.forgemind.core.model.EvolutionDecision;
import com.forgemind.core.trigger.EvolutionSweep;
import com.forgemind.core.trigger.EvolutionTrigger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: forgemind check [behaviorId] [--sweep]
 * <p>
 * Reports whether a behavior should evolve, or with {@code --sweep} submits jobs for every
 * triggered active behavior.
 */
@Command(name = "check", mixinStandardHelpOptions = true, description = "Evaluate evolution triggers")
@Component
public class CheckCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Behavior id")
    private String behaviorId;

    @Option(names = "--sweep", description = "Check all active behaviors and submit triggered jobs")
    private boolean sweep;

    private final EvolutionTrigger trigger;
    private final EvolutionSweep evolutionSweep;

    public CheckCommand(EvolutionTrigger trigger, EvolutionSweep evolutionSweep) {
        this.trigger = trigger;
        this.evolutionSweep = evolutionSweep;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (sweep) {
            List<EvolutionJob> jobs = evolutionSweep.runOnce();
            ConsoleOutput.info("Submitted " + jobs.size() + " evolution job" + (jobs.size() != 1 ? "s" : ""));
            jobs.forEach(j -> ConsoleOutput.success(j.jobId() + " " + j.behaviorId()
                    + " (" + j.request().triggerReason() + ")"));
            jobs.forEach(j -> j.result().join());
            return;
        }
        if (behaviorId == null) {
            ConsoleOutput.error("Specify a behavior id or --sweep");
            return;
        }
        EvolutionDecision decision = trigger.shouldEvolve(behaviorId);
        if (decision.shouldEvolve()) {
            ConsoleOutput.success(behaviorId + " should evolve: " + decision.reason());
        } else {
            ConsoleOutput.info(behaviorId + " does not need evolution: " + decision.reason());
        }
    }
}
