package com.forgemind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Forgemind.
 */
@Command(
        name = "forgemind",
        mixinStandardHelpOptions = true,
        version = "Forgemind 0.1.0",
        description = "Behavior registry with genetic prompt evolution",
        subcommands = {
                BehaviorsCommand.class,
                EvolveCommand.class,
                HistoryCommand.class,
                StatusCommand.class,
                CompareCommand.class,
                CheckCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ForgemindCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
