package com.forgemind.dispatch.cli;

import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.LifecycleState;
import com.forgemind.core.registry.BehaviorFilter;
import com.forgemind.core.registry.BehaviorRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: forgemind behaviors
 * <p>
 * Lists registered behaviors as a table: ID | Version | Lifecycle | Success | Name.
 */
@Command(name = "behaviors", mixinStandardHelpOptions = true, description = "List registered behaviors")
@Component
public class BehaviorsCommand implements Runnable {

    @Option(names = {"--lifecycle", "-l"}, description = "Only behaviors in this lifecycle state")
    private LifecycleState lifecycle;

    @Option(names = {"--search", "-s"}, description = "Rank by relevance to this query")
    private String query;

    private final BehaviorRegistry registry;

    public BehaviorsCommand(BehaviorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<Behavior> behaviors = query != null
                ? registry.search(query, 20)
                : registry.list(new BehaviorFilter(null, lifecycle, null));
        if (behaviors.isEmpty()) {
            ConsoleOutput.info("No behaviors found.");
            return;
        }
        ConsoleOutput.info("Behaviors (" + behaviors.size() + "):");
        System.out.println();
        System.out.printf("  %-24s %-8s %-11s %-8s %s%n", "ID", "VERSION", "LIFECYCLE", "SUCCESS", "NAME");
        System.out.println("  " + "-".repeat(76));
        for (Behavior b : behaviors) {
            String success = b.stats().total() == 0 ? "-"
                    : String.format("%.0f%%", 100.0 * b.stats().successCount() / b.stats().total());
            System.out.printf("  %-24s %-8s %-11s %-8s %s%n", ConsoleOutput.truncate(b.id(), 24), b.version(),
                    b.lifecycle(), success, ConsoleOutput.truncate(b.name(), 30));
        }
    }
}
