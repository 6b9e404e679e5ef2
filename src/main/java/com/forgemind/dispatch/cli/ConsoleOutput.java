package com.forgemind.dispatch.cli;

import com.forgemind.core.model.EvolutionResult;
import com.forgemind.core.model.GenerationSummary;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Forgemind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FORGEMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FORGEMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warning(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) !|@ " + message));
    }

    public static void generation(GenerationSummary g) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|fg(blue) [GEN %d]|@ best %.3f, best-so-far %.3f (holdout %.3f), %d rejected, %s",
                g.generation(), g.bestTrainFitness(), g.bestSoFarFitness(), g.bestHoldoutFitness(),
                g.rejected(), formatDuration(g.elapsedMs()))));
    }

    public static void evolutionResult(EvolutionResult r) {
        System.out.println("──────────────────────────────────");
        for (GenerationSummary g : r.generations()) {
            generation(g);
        }
        String fitness = String.format("best %.3f, holdout %.3f, production %.3f",
                r.bestFitness(), r.holdoutFitness(), r.productionFitness());
        if (r.improved()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(green),bold [IMPROVED]|@ " + r.fromVersion() + " -> " + r.newVersion() + ", " + fitness));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(yellow),bold [" + r.status() + "]|@ " + fitness));
        }
        for (String warning : r.warnings()) {
            warning(warning);
        }
        if (r.promptDiff() != null && !r.promptDiff().isEmpty()) {
            System.out.println();
            diff(r.promptDiff());
        }
    }

    /** Colors only the diff markers; prompt text is printed verbatim. */
    public static void diff(String diff) {
        for (String line : diff.split("\n")) {
            if (line.startsWith("+ ")) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(green) +|@ ") + line.substring(2));
            } else if (line.startsWith("- ")) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red) -|@ ") + line.substring(2));
            } else {
                System.out.println("  " + line);
            }
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
